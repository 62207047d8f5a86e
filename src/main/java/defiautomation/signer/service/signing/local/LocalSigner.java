package defiautomation.signer.service.signing.local;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.signing.SignatureResult;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.signing.SigningKey;
import defiautomation.signer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Development signer that keeps AES-GCM encrypted private keys in a
 * {@link KeyMaterialRepository}. Keys are decrypted only for the duration of
 * a single signature.
 */
@Slf4j
public class LocalSigner implements SigningBackend {

    public static final String KEY_ID_PREFIX = "local-";

    private static final BigInteger CURVE_ORDER = Sign.CURVE_PARAMS.getN();
    private static final int KEY_ID_RANDOM_BYTES = 8;

    private final KeyStore keyStore;
    private final SecureRandom secureRandom;
    private final Map<String, String> addressCache = new ConcurrentHashMap<>();

    public LocalSigner(KeyMaterialRepository repository, String masterKeyHex) {
        this(new KeyStore(repository, new KeyCipher(masterKeyHex)), new SecureRandom());
    }

    public LocalSigner(KeyStore keyStore, SecureRandom secureRandom) {
        this.keyStore = keyStore;
        this.secureRandom = secureRandom;
    }

    @Override
    public SigningKey createKey(String label) {
        return storeKey(label, randomScalar());
    }

    /**
     * Stores an existing private key under a fresh key id.
     */
    public SigningKey importKey(String label, String privateKeyHex) {
        BigInteger privateKey;
        try {
            privateKey = Numeric.toBigInt(privateKeyHex);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Private key is not valid hex", ex);
        }
        if (privateKey.signum() <= 0 || privateKey.compareTo(CURVE_ORDER) >= 0) {
            throw new IllegalArgumentException("Private key is outside the secp256k1 range");
        }
        return storeKey(label, privateKey);
    }

    /**
     * Re-hydrates a key record produced by another instance sharing the same master key.
     */
    public SigningKey loadKey(String keyId, String encryptedMaterial) {
        BigInteger privateKey = keyStore.decryptPrivateKey(encryptedMaterial);
        String address = Keys.toChecksumAddress(Keys.getAddress(ECKeyPair.create(privateKey).getPublicKey()));
        keyStore.restore(keyId, address, null, encryptedMaterial);
        addressCache.put(keyId, address);
        return SigningKey.local(keyId, address, encryptedMaterial);
    }

    @Override
    public String getAddress(String keyId) {
        String cached = addressCache.get(keyId);
        if (cached != null) {
            return cached;
        }
        String address = keyStore.find(keyId).walletAddress();
        addressCache.put(keyId, address);
        return address;
    }

    @Override
    public SignatureResult signHash(String keyId, byte[] hash) {
        if (hash == null || hash.length != 32) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        long started = System.nanoTime();
        BigInteger privateKey = keyStore.loadPrivateKey(keyId);
        try {
            Sign.SignatureData data = Sign.signMessage(hash, ECKeyPair.create(privateKey), false);
            SignatureResult result = SignatureResult.fromSignatureData(data);
            log.debug("Local signature produced for key {} in {} ms",
                LogSanitizer.maskIdentifier(keyId), (System.nanoTime() - started) / 1_000_000);
            return result;
        } catch (RuntimeException ex) {
            throw new SigningFailedException("Local signing failed for key " + LogSanitizer.maskIdentifier(keyId), ex);
        }
    }

    @Override
    public void discardKey(String keyId) {
        keyStore.delete(keyId);
        addressCache.remove(keyId);
        log.info("Discarded local key {}", LogSanitizer.maskIdentifier(keyId));
    }

    @Override
    public KeyProvider provider() {
        return KeyProvider.LOCAL;
    }

    @Override
    public void validateConfig() {
        // the master key was checked when the cipher was built
        log.info("Local signer ready (development key custody)");
    }

    private SigningKey storeKey(String label, BigInteger privateKey) {
        String keyId = KEY_ID_PREFIX + randomHex();
        String address = Keys.toChecksumAddress(Keys.getAddress(ECKeyPair.create(privateKey).getPublicKey()));
        StoredKey stored = keyStore.store(keyId, address, label, privateKey);
        addressCache.put(keyId, address);
        log.info("Created local key {} for {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.maskIdentifier(address));
        return SigningKey.local(keyId, address, stored.encryptedMaterial());
    }

    private BigInteger randomScalar() {
        BigInteger candidate;
        do {
            candidate = new BigInteger(256, secureRandom);
        } while (candidate.signum() == 0 || candidate.compareTo(CURVE_ORDER) >= 0);
        return candidate;
    }

    private String randomHex() {
        byte[] bytes = new byte[KEY_ID_RANDOM_BYTES];
        secureRandom.nextBytes(bytes);
        return Numeric.toHexStringNoPrefix(bytes);
    }
}
