package defiautomation.signer.service.signing;

import java.util.Objects;

/**
 * Opaque handle to a signing key held by a {@link SigningBackend}.
 *
 * @param keyId             backend-specific identifier
 * @param walletAddress     checksummed address derived from the public key
 * @param provider          backend that owns the key
 * @param encryptedMaterial AES-GCM record of the private key, only for {@link KeyProvider#LOCAL}
 */
public record SigningKey(String keyId, String walletAddress, KeyProvider provider, String encryptedMaterial) {

    public SigningKey {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(walletAddress, "walletAddress");
        Objects.requireNonNull(provider, "provider");
        if (provider == KeyProvider.MANAGED_HSM && encryptedMaterial != null) {
            throw new IllegalArgumentException("Managed HSM keys never carry key material");
        }
    }

    public static SigningKey managed(String keyId, String walletAddress) {
        return new SigningKey(keyId, walletAddress, KeyProvider.MANAGED_HSM, null);
    }

    public static SigningKey local(String keyId, String walletAddress, String encryptedMaterial) {
        return new SigningKey(keyId, walletAddress, KeyProvider.LOCAL, encryptedMaterial);
    }

    @Override
    public String toString() {
        // encrypted material stays out of logs
        return "SigningKey[keyId=" + keyId + ", walletAddress=" + walletAddress + ", provider=" + provider + "]";
    }
}
