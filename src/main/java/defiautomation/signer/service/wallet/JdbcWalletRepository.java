package defiautomation.signer.service.wallet;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import defiautomation.signer.exception.WalletExistsException;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "jdbc")
public class JdbcWalletRepository implements WalletRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcWalletRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(AutomationWallet wallet) {
        try {
            jdbcTemplate.update(
                """
                INSERT INTO automation_wallets (
                    id, owner_ref, purpose, label, wallet_hash, wallet_address, key_config,
                    active_owner_key, active, created_at, updated_at, last_used_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                wallet.getId(),
                wallet.getOwnerRef(),
                wallet.getPurpose().getWireValue(),
                wallet.getLabel(),
                wallet.getWalletHash(),
                wallet.getWalletAddress().toLowerCase(Locale.ROOT),
                writeKeyConfig(wallet.getKeyConfig()),
                wallet.isActive() ? wallet.getPurpose().activeOwnerKey(wallet.getOwnerRef()) : null,
                wallet.isActive(),
                toTimestamp(wallet.getCreatedAt()),
                toTimestamp(wallet.getUpdatedAt()),
                toTimestamp(wallet.getLastUsedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new WalletExistsException("Wallet already exists for owner or address", e);
        }
    }

    @Override
    public Optional<AutomationWallet> findById(String walletId) {
        return jdbcTemplate.query(
            "SELECT * FROM automation_wallets WHERE id = ? LIMIT 1",
            this::mapRow,
            walletId
        ).stream().findFirst();
    }

    @Override
    public Optional<AutomationWallet> findActiveByOwner(String ownerRef, WalletPurpose purpose) {
        return jdbcTemplate.query(
            "SELECT * FROM automation_wallets WHERE active_owner_key = ? LIMIT 1",
            this::mapRow,
            purpose.activeOwnerKey(ownerRef)
        ).stream().findFirst();
    }

    @Override
    public Optional<AutomationWallet> findByAddress(String walletAddress) {
        return jdbcTemplate.query(
            "SELECT * FROM automation_wallets WHERE wallet_address = ? ORDER BY active DESC, created_at DESC LIMIT 1",
            this::mapRow,
            walletAddress.toLowerCase(Locale.ROOT)
        ).stream().findFirst();
    }

    @Override
    public boolean deactivate(String walletId, Instant at) {
        int updated = jdbcTemplate.update(
            "UPDATE automation_wallets SET active = FALSE, active_owner_key = NULL, updated_at = ? WHERE id = ? AND active = TRUE",
            Timestamp.from(at),
            walletId
        );
        return updated > 0;
    }

    @Override
    public void touchLastUsed(String walletId, Instant at) {
        jdbcTemplate.update(
            "UPDATE automation_wallets SET last_used_at = ?, updated_at = ? WHERE id = ?",
            Timestamp.from(at),
            Timestamp.from(at),
            walletId
        );
    }

    private AutomationWallet mapRow(ResultSet rs, int rowNum) throws SQLException {
        return AutomationWallet.builder()
            .id(rs.getString("id"))
            .ownerRef(rs.getString("owner_ref"))
            .purpose(WalletPurpose.fromWireValue(rs.getString("purpose")))
            .label(rs.getString("label"))
            .keyConfig(readKeyConfig(rs.getString("key_config")))
            .active(rs.getBoolean("active"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .lastUsedAt(toInstant(rs.getTimestamp("last_used_at")))
            .build();
    }

    private String writeKeyConfig(WalletKeyConfig keyConfig) {
        try {
            return objectMapper.writerFor(WalletKeyConfig.class).writeValueAsString(keyConfig);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize wallet key config", e);
        }
    }

    private WalletKeyConfig readKeyConfig(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalStateException("Wallet key config is missing");
        }
        WalletKeyConfig config;
        try {
            config = objectMapper.readValue(json, WalletKeyConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Wallet key config is not readable", e);
        }
        config.validate();
        return config;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
