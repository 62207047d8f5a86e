package defiautomation.signer.service.intent;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryIntentNonceRepository implements IntentNonceRepository {

    private final Map<String, Instant> used = new ConcurrentHashMap<>();

    @Override
    public boolean isUsed(String signer, long chainId, BigInteger nonce) {
        return used.containsKey(key(signer, chainId, nonce));
    }

    @Override
    public boolean markUsed(String signer, long chainId, BigInteger nonce, String intentType, Instant usedAt) {
        return used.putIfAbsent(key(signer, chainId, nonce), usedAt) == null;
    }

    private static String key(String signer, long chainId, BigInteger nonce) {
        return signer.toLowerCase(Locale.ROOT) + ":" + chainId + ":" + nonce;
    }
}
