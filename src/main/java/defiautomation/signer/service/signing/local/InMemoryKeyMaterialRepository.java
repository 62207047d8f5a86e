package defiautomation.signer.service.signing.local;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryKeyMaterialRepository implements KeyMaterialRepository {

    private final Map<String, StoredKey> keys = new ConcurrentHashMap<>();

    @Override
    public void save(StoredKey key) {
        keys.put(key.keyId(), key);
    }

    @Override
    public Optional<StoredKey> findByKeyId(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(keyId));
    }

    @Override
    public void delete(String keyId) {
        keys.remove(keyId);
    }
}
