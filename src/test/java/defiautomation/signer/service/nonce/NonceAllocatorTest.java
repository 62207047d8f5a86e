package defiautomation.signer.service.nonce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import defiautomation.signer.exception.NoWalletException;
import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.wallet.AutomationWallet;
import defiautomation.signer.service.wallet.EvmWalletKeyConfig;
import defiautomation.signer.service.wallet.InMemoryWalletRepository;
import defiautomation.signer.service.wallet.WalletPurpose;
import defiautomation.signer.support.TestKeys;

class NonceAllocatorTest {

    private static final String WALLET_ID = "wallet-1";

    private NonceAllocator allocator;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        InMemoryWalletRepository wallets = new InMemoryWalletRepository();
        wallets.insert(AutomationWallet.builder()
            .id(WALLET_ID)
            .ownerRef("user-1")
            .purpose(WalletPurpose.AUTOMATION)
            .label("Primary")
            .keyConfig(new EvmWalletKeyConfig(TestKeys.ADDRESS, "kms-1", KeyProvider.MANAGED_HSM, null))
            .active(true)
            .createdAt(Instant.parse("2026-03-01T12:00:00Z"))
            .updatedAt(Instant.parse("2026-03-01T12:00:00Z"))
            .build());
        allocator = new NonceAllocator(new InMemoryNonceStore(), wallets);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Nested
    @DisplayName("Allocation Tests")
    class AllocationTests {

        @Test
        @DisplayName("Should start at zero and increment by one")
        void shouldAllocateSequentially() {
            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isZero();
            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isEqualTo(1L);
            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isEqualTo(2L);
            assertThat(allocator.peek(WALLET_ID, 1L)).isEqualTo(3L);
        }

        @Test
        @DisplayName("Should keep independent counters per chain")
        void shouldSeparateChains() {
            allocator.allocateAndIncrement(WALLET_ID, 1L);
            allocator.allocateAndIncrement(WALLET_ID, 1L);

            assertThat(allocator.allocateAndIncrement(WALLET_ID, 137L)).isZero();
            assertThat(allocator.peek(WALLET_ID, 1L)).isEqualTo(2L);
        }

        @Test
        @DisplayName("Should hand out each nonce exactly once under concurrency")
        void shouldAllocateDistinctNoncesConcurrently() throws Exception {
            int callers = 64;
            executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Callable<Long>> tasks = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                tasks.add(() -> {
                    start.await();
                    return allocator.allocateAndIncrement(WALLET_ID, 1L);
                });
            }
            List<Future<Long>> futures = new ArrayList<>();
            for (Callable<Long> task : tasks) {
                futures.add(executor.submit(task));
            }
            start.countDown();

            Set<Long> nonces = ConcurrentHashMap.newKeySet();
            for (Future<Long> future : futures) {
                nonces.add(future.get());
            }

            assertThat(nonces).isEqualTo(LongStream.range(0, callers).boxed().collect(Collectors.toSet()));
            assertThat(allocator.peek(WALLET_ID, 1L)).isEqualTo(callers);
        }
    }

    @Nested
    @DisplayName("Peek And Reset Tests")
    class PeekAndResetTests {

        @Test
        @DisplayName("Should report zero for an unused pair")
        void shouldPeekZeroWhenAbsent() {
            assertThat(allocator.peek(WALLET_ID, 10L)).isZero();
        }

        @Test
        @DisplayName("Should continue from the reset value")
        void shouldResetNextNonce() {
            allocator.allocateAndIncrement(WALLET_ID, 1L);
            allocator.allocateAndIncrement(WALLET_ID, 1L);

            allocator.reset(WALLET_ID, 1L, 5L);

            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isEqualTo(5L);
            assertThat(allocator.peek(WALLET_ID, 1L)).isEqualTo(6L);
        }

        @Test
        @DisplayName("Should reuse a nonce after rewinding")
        void shouldRewind() {
            allocator.allocateAndIncrement(WALLET_ID, 1L);
            long abandoned = allocator.allocateAndIncrement(WALLET_ID, 1L);

            allocator.reset(WALLET_ID, 1L, abandoned);

            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isEqualTo(abandoned);
        }

        @Test
        @DisplayName("Should release the most recent allocation")
        void shouldReleaseLatestNonce() {
            allocator.allocateAndIncrement(WALLET_ID, 1L);
            long latest = allocator.allocateAndIncrement(WALLET_ID, 1L);

            assertThat(allocator.release(WALLET_ID, 1L, latest)).isTrue();
            assertThat(allocator.allocateAndIncrement(WALLET_ID, 1L)).isEqualTo(latest);
        }

        @Test
        @DisplayName("Should refuse to release a nonce once later ones were allocated")
        void shouldNotReleaseOlderNonce() {
            long older = allocator.allocateAndIncrement(WALLET_ID, 1L);
            allocator.allocateAndIncrement(WALLET_ID, 1L);

            assertThat(allocator.release(WALLET_ID, 1L, older)).isFalse();
            assertThat(allocator.peek(WALLET_ID, 1L)).isEqualTo(2L);
        }

        @Test
        @DisplayName("Should reject a negative reset value")
        void shouldRejectNegativeReset() {
            assertThatThrownBy(() -> allocator.reset(WALLET_ID, 1L, -1L))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should fail with NoWalletException for an unknown wallet")
    void shouldRejectUnknownWallet() {
        assertThatThrownBy(() -> allocator.allocateAndIncrement("missing", 1L))
            .isInstanceOf(NoWalletException.class);
        assertThatThrownBy(() -> allocator.peek("missing", 1L))
            .isInstanceOf(NoWalletException.class);
        assertThatThrownBy(() -> allocator.reset("missing", 1L, 0L))
            .isInstanceOf(NoWalletException.class);
    }
}
