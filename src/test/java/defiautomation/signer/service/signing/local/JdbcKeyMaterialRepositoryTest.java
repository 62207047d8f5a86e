package defiautomation.signer.service.signing.local;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import defiautomation.signer.support.TestKeys;

@ExtendWith(MockitoExtension.class)
class JdbcKeyMaterialRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcKeyMaterialRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcKeyMaterialRepository(jdbcTemplate);
    }

    @Test
    @DisplayName("Should upsert the encrypted record")
    void shouldSaveRecord() {
        repository.save(new StoredKey("local-1", TestKeys.ADDRESS, "bot", "iv:cipher", Instant.parse("2026-03-01T12:00:00Z")));

        verify(jdbcTemplate).update(contains("INSERT INTO signing_keys"),
            eq("local-1"), eq(TestKeys.ADDRESS), eq("bot"), eq("iv:cipher"), any());
    }

    @Test
    @DisplayName("Should delete the record by key id")
    void shouldDeleteRecord() {
        repository.delete("local-1");

        verify(jdbcTemplate).update(contains("DELETE FROM signing_keys"), eq("local-1"));
    }
}
