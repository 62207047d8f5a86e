package defiautomation.signer.service.intent;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "jdbc")
public class JdbcIntentNonceRepository implements IntentNonceRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcIntentNonceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isUsed(String signer, long chainId, BigInteger nonce) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM intent_nonces WHERE signer = ? AND chain_id = ? AND nonce = ?",
            Integer.class,
            signer.toLowerCase(Locale.ROOT),
            chainId,
            nonce.toString()
        );
        return count != null && count > 0;
    }

    @Override
    public boolean markUsed(String signer, long chainId, BigInteger nonce, String intentType, Instant usedAt) {
        try {
            jdbcTemplate.update(
                "INSERT INTO intent_nonces (signer, chain_id, nonce, intent_type, used_at) VALUES (?, ?, ?, ?, ?)",
                signer.toLowerCase(Locale.ROOT),
                chainId,
                nonce.toString(),
                intentType,
                Timestamp.from(usedAt)
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }
}
