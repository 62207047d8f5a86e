package defiautomation.signer.service.signing.local;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;

import org.web3j.utils.Numeric;

import defiautomation.signer.exception.KeyNotFoundException;

/**
 * Encrypts private keys before they reach the {@link KeyMaterialRepository}
 * and decrypts them on demand. Plaintext keys are never retained.
 */
public class KeyStore {

    private static final int PRIVATE_KEY_LENGTH = 32;

    private final KeyMaterialRepository repository;
    private final KeyCipher cipher;

    public KeyStore(KeyMaterialRepository repository, KeyCipher cipher) {
        this.repository = repository;
        this.cipher = cipher;
    }

    /**
     * Encrypts and saves a private key.
     *
     * @return the stored record
     */
    public StoredKey store(String keyId, String walletAddress, String label, BigInteger privateKey) {
        byte[] keyBytes = Numeric.toBytesPadded(privateKey, PRIVATE_KEY_LENGTH);
        try {
            StoredKey stored = new StoredKey(keyId, walletAddress, label, cipher.encrypt(keyBytes), Instant.now());
            repository.save(stored);
            return stored;
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Saves a record that was encrypted elsewhere under the same master key.
     * The record is decrypted once to prove it belongs to this master key.
     */
    public StoredKey restore(String keyId, String walletAddress, String label, String encryptedMaterial) {
        byte[] keyBytes = cipher.decrypt(encryptedMaterial);
        Arrays.fill(keyBytes, (byte) 0);
        StoredKey stored = new StoredKey(keyId, walletAddress, label, encryptedMaterial, Instant.now());
        repository.save(stored);
        return stored;
    }

    public void delete(String keyId) {
        repository.delete(keyId);
    }

    public StoredKey find(String keyId) {
        return repository.findByKeyId(keyId).orElseThrow(() -> new KeyNotFoundException(keyId));
    }

    public BigInteger loadPrivateKey(String keyId) {
        return decryptPrivateKey(find(keyId).encryptedMaterial());
    }

    public BigInteger decryptPrivateKey(String encryptedMaterial) {
        byte[] keyBytes = cipher.decrypt(encryptedMaterial);
        try {
            return new BigInteger(1, keyBytes);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }
}
