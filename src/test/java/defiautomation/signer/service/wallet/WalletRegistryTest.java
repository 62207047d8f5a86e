package defiautomation.signer.service.wallet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import defiautomation.signer.exception.KeyNotFoundException;
import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.exception.WalletExistsException;
import defiautomation.signer.exception.WalletNotFoundException;
import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.signing.SigningKey;
import defiautomation.signer.service.signing.local.LocalSigner;
import defiautomation.signer.support.TestKeys;

@DisplayName("WalletRegistry Tests")
class WalletRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryWalletRepository repository;
    private LocalSigner signer;
    private WalletRegistry registry;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWalletRepository();
        signer = TestKeys.localSigner();
        registry = new WalletRegistry(repository, signer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("Should create an active automation wallet backed by a new key")
        void shouldCreateWallet() {
            AutomationWallet wallet = registry.create("user-1", "Primary");

            assertThat(wallet.getId()).isNotBlank();
            assertThat(wallet.getPurpose()).isEqualTo(WalletPurpose.AUTOMATION);
            assertThat(wallet.isActive()).isTrue();
            assertThat(wallet.getCreatedAt()).isEqualTo(NOW);
            assertThat(wallet.getKeyConfig().provider()).isEqualTo(KeyProvider.LOCAL);
            assertThat(signer.getAddress(wallet.getKeyId())).isEqualTo(wallet.getWalletAddress());
            assertThat(wallet.getWalletHash())
                .isEqualTo("evm/automation/" + wallet.getWalletAddress().toLowerCase(Locale.ROOT));
        }

        @Test
        @DisplayName("Should refuse a second active wallet for the same owner")
        void shouldRefuseSecondWallet() {
            registry.create("user-1", "Primary");

            assertThatThrownBy(() -> registry.create("user-1", "Again"))
                .isInstanceOf(WalletExistsException.class);
        }

        @Test
        @DisplayName("Should allow one wallet per purpose")
        void shouldAllowOneWalletPerPurpose() {
            AutomationWallet automation = registry.create("user-1", "Primary");
            AutomationWallet strategy = registry.create("user-1", "Strategy", WalletPurpose.STRATEGY);

            assertThat(strategy.getWalletAddress()).isNotEqualTo(automation.getWalletAddress());
            assertThat(registry.getByOwner("user-1", WalletPurpose.STRATEGY)).contains(strategy);
        }

        @Test
        @DisplayName("Should map a unique constraint race to WalletExistsException")
        void shouldMapRace() {
            WalletRepository racing = mock(WalletRepository.class);
            doThrow(new WalletExistsException("duplicate")).when(racing).insert(any());
            WalletRegistry racingRegistry = new WalletRegistry(racing, signer, Clock.fixed(NOW, ZoneOffset.UTC));

            assertThatThrownBy(() -> racingRegistry.create("user-1", "Primary"))
                .isInstanceOf(WalletExistsException.class);
        }

        @Test
        @DisplayName("Should discard the new key when the wallet row cannot be inserted")
        void shouldDiscardKeyWhenInsertFails() {
            WalletRepository racing = mock(WalletRepository.class);
            doThrow(new WalletExistsException("duplicate")).when(racing).insert(any());
            WalletRegistry racingRegistry = new WalletRegistry(racing, signer, Clock.fixed(NOW, ZoneOffset.UTC));

            assertThatThrownBy(() -> racingRegistry.create("user-1", "Primary"))
                .isInstanceOf(WalletExistsException.class);

            ArgumentCaptor<AutomationWallet> inserted = ArgumentCaptor.forClass(AutomationWallet.class);
            verify(racing).insert(inserted.capture());
            String keyId = inserted.getValue().getKeyId();
            assertThatThrownBy(() -> signer.getAddress(keyId))
                .isInstanceOf(KeyNotFoundException.class);
        }

        @Test
        @DisplayName("Should keep the insert failure when discarding the key also fails")
        void shouldSuppressDiscardFailure() {
            WalletRepository racing = mock(WalletRepository.class);
            WalletExistsException duplicate = new WalletExistsException("duplicate");
            doThrow(duplicate).when(racing).insert(any());
            SigningBackend backend = mock(SigningBackend.class);
            when(backend.createKey(anyString())).thenReturn(SigningKey.managed("kms-1", TestKeys.ADDRESS));
            doThrow(new SigningFailedException("KMS unavailable")).when(backend).discardKey("kms-1");
            WalletRegistry racingRegistry = new WalletRegistry(racing, backend, Clock.fixed(NOW, ZoneOffset.UTC));

            Throwable thrown = catchThrowable(() -> racingRegistry.create("user-1", "Primary"));

            assertThat(thrown).isSameAs(duplicate);
            assertThat(thrown.getSuppressed()).hasSize(1);
        }

        @Test
        @DisplayName("Should reject a blank owner")
        void shouldRejectBlankOwner() {
            assertThatThrownBy(() -> registry.create(" ", "Primary"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Should find wallets by address regardless of case")
        void shouldFindByAddressCaseInsensitive() {
            AutomationWallet wallet = registry.create("user-1", "Primary");

            assertThat(registry.getByAddress(wallet.getWalletAddress().toLowerCase(Locale.ROOT)))
                .map(AutomationWallet::getId).contains(wallet.getId());
            assertThat(registry.getByAddress("0x" + wallet.getWalletAddress().substring(2).toUpperCase(Locale.ROOT)))
                .map(AutomationWallet::getId).contains(wallet.getId());
        }

        @Test
        @DisplayName("Should return empty for unknown or malformed addresses")
        void shouldReturnEmptyForUnknownAddress() {
            assertThat(registry.getByAddress(TestKeys.ADDRESS)).isEmpty();
            assertThat(registry.getByAddress("not-an-address")).isEmpty();
        }

        @Test
        @DisplayName("Should return the existing wallet from getOrCreate")
        void shouldReturnExistingFromGetOrCreate() {
            AutomationWallet first = registry.getOrCreate("user-1", "Primary");
            AutomationWallet second = registry.getOrCreate("user-1", "Other");

            assertThat(second.getId()).isEqualTo(first.getId());
        }

        @Test
        @DisplayName("Should throw when requiring a wallet the owner does not have")
        void shouldThrowWhenRequiringMissingWallet() {
            assertThatThrownBy(() -> registry.requireActive("nobody"))
                .isInstanceOf(WalletNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Deactivation and Usage")
    class LifecycleTests {

        @Test
        @DisplayName("Should deactivate without deleting and allow a new wallet")
        void shouldDeactivateAndAllowNewWallet() {
            AutomationWallet first = registry.create("user-1", "Primary");

            assertThat(registry.deactivate("user-1")).isTrue();
            assertThat(registry.getByOwner("user-1")).isEmpty();
            assertThat(registry.getById(first.getId())).map(AutomationWallet::isActive).contains(false);

            AutomationWallet second = registry.create("user-1", "Replacement");
            assertThat(second.getId()).isNotEqualTo(first.getId());
        }

        @Test
        @DisplayName("Should return false when there is nothing to deactivate")
        void shouldReturnFalseWhenNothingToDeactivate() {
            assertThat(registry.deactivate("nobody")).isFalse();
        }

        @Test
        @DisplayName("Should record usage time")
        void shouldRecordUsage() {
            AutomationWallet wallet = registry.create("user-1", "Primary");

            registry.recordUsage(wallet.getId());

            Optional<AutomationWallet> reloaded = registry.getById(wallet.getId());
            assertThat(reloaded).map(AutomationWallet::getLastUsedAt).contains(NOW);
        }

        @Test
        @DisplayName("Should swallow usage update failures")
        void shouldSwallowUsageFailures() {
            WalletRepository failing = mock(WalletRepository.class);
            doThrow(new DataAccessResourceFailureException("down")).when(failing).touchLastUsed(anyString(), any());
            WalletRegistry failingRegistry = new WalletRegistry(failing, signer, Clock.fixed(NOW, ZoneOffset.UTC));

            failingRegistry.recordUsage("wallet-1");
        }
    }
}
