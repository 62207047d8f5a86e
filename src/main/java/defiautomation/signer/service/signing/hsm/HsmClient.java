package defiautomation.signer.service.signing.hsm;

import java.util.Map;

/**
 * Narrow view of a managed key service holding secp256k1 keys.
 *
 * <p>Implementations report unknown keys with
 * {@link defiautomation.signer.exception.KeyNotFoundException} and any other
 * service failure with {@link defiautomation.signer.exception.SigningFailedException}.
 */
public interface HsmClient {

    /**
     * @return identifier of the new key
     */
    String createKey(String description, Map<String, String> tags);

    /**
     * @return DER-encoded SubjectPublicKeyInfo
     */
    byte[] getPublicKey(String keyId);

    /**
     * Signs a precomputed 32-byte digest.
     *
     * @return DER-encoded ECDSA signature
     */
    byte[] sign(String keyId, byte[] digest);

    /**
     * Schedules the key for deletion after the service's minimum waiting period.
     */
    void scheduleKeyDeletion(String keyId);

    /**
     * Cheap call proving the service is reachable with the configured credentials.
     */
    void verifyAccess();
}
