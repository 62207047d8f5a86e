package defiautomation.signer.service.nonce;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MySQL nonce counter. The upsert takes the row lock, so the read that
 * follows inside the same transaction sees only this caller's increment.
 */
@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "jdbc")
public class JdbcNonceStore implements NonceStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcNonceStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public long allocate(String walletId, long chainId) {
        Long allocated = transactionTemplate.execute(status -> {
            jdbcTemplate.update(
                """
                INSERT INTO wallet_nonces (wallet_id, chain_id, next_nonce, updated_at)
                VALUES (?, ?, 1, ?)
                ON DUPLICATE KEY UPDATE
                    next_nonce = next_nonce + 1,
                    updated_at = VALUES(updated_at)
                """,
                walletId,
                chainId,
                Timestamp.from(Instant.now())
            );
            Long next = jdbcTemplate.queryForObject(
                "SELECT next_nonce FROM wallet_nonces WHERE wallet_id = ? AND chain_id = ?",
                Long.class,
                walletId,
                chainId
            );
            if (next == null) {
                throw new IllegalStateException("Nonce row vanished inside its own transaction");
            }
            return next - 1;
        });
        if (allocated == null) {
            throw new IllegalStateException("Nonce allocation returned no value");
        }
        return allocated;
    }

    @Override
    public long current(String walletId, long chainId) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT next_nonce FROM wallet_nonces WHERE wallet_id = ? AND chain_id = ?",
            Long.class,
            walletId,
            chainId
        );
        return rows.isEmpty() || rows.get(0) == null ? 0L : rows.get(0);
    }

    @Override
    public void overwrite(String walletId, long chainId, long nextNonce) {
        jdbcTemplate.update(
            """
            INSERT INTO wallet_nonces (wallet_id, chain_id, next_nonce, updated_at)
            VALUES (?, ?, ?, ?)
            ON DUPLICATE KEY UPDATE
                next_nonce = VALUES(next_nonce),
                updated_at = VALUES(updated_at)
            """,
            walletId,
            chainId,
            nextNonce,
            Timestamp.from(Instant.now())
        );
    }

    @Override
    public boolean release(String walletId, long chainId, long nonce) {
        int updated = jdbcTemplate.update(
            """
            UPDATE wallet_nonces SET next_nonce = ?, updated_at = ?
            WHERE wallet_id = ? AND chain_id = ? AND next_nonce = ?
            """,
            nonce,
            Timestamp.from(Instant.now()),
            walletId,
            chainId,
            nonce + 1
        );
        return updated == 1;
    }
}
