package defiautomation.signer.service.signing;

/**
 * Key custody contract. Implementations sign a raw 32-byte digest with no
 * message prefix, so the recovered address matches the transaction sender.
 *
 * <p>Exactly two implementations exist: {@code LocalSigner} for development
 * and tests, and {@code ManagedHsmSigner} for production key custody. The
 * backend is chosen once at startup by {@link SignerFactory}.
 */
public interface SigningBackend {

    /**
     * Generates a new key.
     *
     * @param label free-form label stored alongside the key
     */
    SigningKey createKey(String label);

    /**
     * @throws defiautomation.signer.exception.KeyNotFoundException if the key id is unknown
     */
    String getAddress(String keyId);

    /**
     * Signs a 32-byte digest.
     *
     * @throws defiautomation.signer.exception.KeyNotFoundException    if the key id is unknown
     * @throws defiautomation.signer.exception.SigningFailedException  on backend failure
     */
    SignatureResult signHash(String keyId, byte[] hash);

    default SignatureResult signTypedDataHash(String keyId, byte[] typedDataHash) {
        return signHash(keyId, typedDataHash);
    }

    default SignatureResult signTransaction(String keyId, byte[] transactionHash) {
        return signHash(keyId, transactionHash);
    }

    /**
     * Removes a key that never became part of a wallet. Managed keys are
     * scheduled for deletion rather than destroyed at once.
     */
    void discardKey(String keyId);

    KeyProvider provider();

    /**
     * Fails fast with a {@link defiautomation.signer.exception.ConfigurationException}
     * when the backend cannot be used.
     */
    void validateConfig();
}
