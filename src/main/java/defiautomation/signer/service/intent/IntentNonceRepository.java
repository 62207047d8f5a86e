package defiautomation.signer.service.intent;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Record of consumed intent nonces, unique per (signer, chainId, nonce).
 * Signers are stored lowercased and nonces in canonical decimal form.
 */
public interface IntentNonceRepository {

    boolean isUsed(String signer, long chainId, BigInteger nonce);

    /**
     * @return false when the nonce was already recorded
     */
    boolean markUsed(String signer, long chainId, BigInteger nonce, String intentType, Instant usedAt);
}
