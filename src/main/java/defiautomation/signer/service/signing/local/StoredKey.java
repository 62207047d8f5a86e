package defiautomation.signer.service.signing.local;

import java.time.Instant;

/**
 * Persisted form of a locally generated key. Only the encrypted record is stored.
 */
public record StoredKey(String keyId, String walletAddress, String label, String encryptedMaterial, Instant createdAt) {

    @Override
    public String toString() {
        return "StoredKey[keyId=" + keyId + ", walletAddress=" + walletAddress + ", label=" + label + "]";
    }
}
