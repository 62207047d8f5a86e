package defiautomation.signer.service.signing.local;

import java.util.Optional;

public interface KeyMaterialRepository {

    void save(StoredKey key);

    Optional<StoredKey> findByKeyId(String keyId);

    void delete(String keyId);
}
