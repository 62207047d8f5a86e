package defiautomation.signer.service.nonce;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryNonceStore implements NonceStore {

    private final Map<String, Long> nextNonces = new ConcurrentHashMap<>();

    @Override
    public long allocate(String walletId, long chainId) {
        long[] allocated = new long[1];
        nextNonces.compute(key(walletId, chainId), (key, next) -> {
            long value = next == null ? 0L : next;
            allocated[0] = value;
            return value + 1;
        });
        return allocated[0];
    }

    @Override
    public long current(String walletId, long chainId) {
        return nextNonces.getOrDefault(key(walletId, chainId), 0L);
    }

    @Override
    public void overwrite(String walletId, long chainId, long nextNonce) {
        nextNonces.put(key(walletId, chainId), nextNonce);
    }

    @Override
    public boolean release(String walletId, long chainId, long nonce) {
        return nextNonces.replace(key(walletId, chainId), nonce + 1, nonce);
    }

    private static String key(String walletId, long chainId) {
        return walletId + ":" + chainId;
    }
}
