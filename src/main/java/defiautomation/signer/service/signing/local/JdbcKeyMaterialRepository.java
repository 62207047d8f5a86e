package defiautomation.signer.service.signing.local;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "jdbc")
public class JdbcKeyMaterialRepository implements KeyMaterialRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcKeyMaterialRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(StoredKey key) {
        jdbcTemplate.update(
            """
            INSERT INTO signing_keys (key_id, wallet_address, label, encrypted_material, created_at)
            VALUES (?, ?, ?, ?, ?)
            ON DUPLICATE KEY UPDATE
                wallet_address = VALUES(wallet_address),
                label = VALUES(label),
                encrypted_material = VALUES(encrypted_material)
            """,
            key.keyId(),
            key.walletAddress(),
            key.label(),
            key.encryptedMaterial(),
            Timestamp.from(key.createdAt())
        );
    }

    @Override
    public Optional<StoredKey> findByKeyId(String keyId) {
        return jdbcTemplate.query(
            "SELECT * FROM signing_keys WHERE key_id = ? LIMIT 1",
            this::mapRow,
            keyId
        ).stream().findFirst();
    }

    @Override
    public void delete(String keyId) {
        jdbcTemplate.update("DELETE FROM signing_keys WHERE key_id = ?", keyId);
    }

    private StoredKey mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new StoredKey(
            rs.getString("key_id"),
            rs.getString("wallet_address"),
            rs.getString("label"),
            rs.getString("encrypted_material"),
            createdAt != null ? createdAt.toInstant() : null
        );
    }
}
