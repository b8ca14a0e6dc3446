package com.commerce.sync.service.lock;

import com.commerce.sync.domain.Lease;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.exception.CoordinationStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LockManager.
 *
 * Tests cover:
 * - Mutual exclusion under concurrent acquire
 * - Lease expiry
 * - Release semantics
 * - Store failures
 */
class LockManagerTest {

    private static final ResourceKey SKU = ResourceKey.of("SKU-001");

    private InMemoryCoordinationStore store;
    private LockManager lockManager;

    @BeforeEach
    void setUp() {
        store = new InMemoryCoordinationStore(Clock.systemUTC());
        lockManager = new LockManager(store, Clock.systemUTC(), "test");
    }

    @Nested
    @DisplayName("Acquire")
    class Acquire {

        @Test
        @DisplayName("Exactly one of N concurrent acquire calls wins")
        void shouldGrantExactlyOneOfConcurrentAcquires() throws Exception {
            // Given
            int callers = 16;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            // When
            try {
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return lockManager.acquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(30));
                    }));
                }
                start.countDown();

                int granted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        granted++;
                    }
                }

                // Then
                assertThat(granted).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Leases are scoped per operation")
        void shouldScopeLeasesByOperation() {
            assertThat(lockManager.acquire(SKU, SyncOperation.INVENTORY)).isTrue();
            assertThat(lockManager.acquire(SKU, SyncOperation.PRICE)).isTrue();
            assertThat(lockManager.acquire(SKU, SyncOperation.INVENTORY)).isFalse();
        }

        @Test
        @DisplayName("Keys differing only in case share one lease")
        void shouldShareLeaseForEquivalentKeys() {
            assertThat(lockManager.acquire(ResourceKey.of("sku-001"), SyncOperation.INVENTORY)).isTrue();
            assertThat(lockManager.acquire(ResourceKey.of(" SKU-001"), SyncOperation.INVENTORY)).isFalse();
            assertThat(LockManager.lockKey(SKU, SyncOperation.INVENTORY)).isEqualTo("sync:lock:SKU-001:inventory");
        }

        @Test
        @DisplayName("Non-positive TTL is rejected")
        void shouldRejectNonPositiveTtl() {
            assertThatThrownBy(() -> lockManager.acquire(SKU, SyncOperation.INVENTORY, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> lockManager.acquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("A lease that is never released stops being held after its TTL")
        void shouldExpireUnreleasedLease() throws InterruptedException {
            // Given
            assertThat(lockManager.acquire(SKU, SyncOperation.INVENTORY, Duration.ofMillis(150))).isTrue();
            assertThat(lockManager.isHeld(SKU, SyncOperation.INVENTORY)).isTrue();

            // When: poll until the TTL has elapsed
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (lockManager.isHeld(SKU, SyncOperation.INVENTORY) && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            // Then
            assertThat(lockManager.isHeld(SKU, SyncOperation.INVENTORY)).isFalse();
            assertThat(lockManager.acquire(SKU, SyncOperation.INVENTORY)).isTrue();
        }
    }

    @Nested
    @DisplayName("Release")
    class Release {

        @Test
        @DisplayName("Releasing a lease makes it available again")
        void shouldReleaseOwnLease() {
            Lease lease = lockManager.tryAcquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(30)).orElseThrow();

            lockManager.release(lease);

            assertThat(lockManager.isHeld(SKU, SyncOperation.INVENTORY)).isFalse();
        }

        @Test
        @DisplayName("A stale lease never deletes a lease now owned by someone else")
        void shouldNotReleaseLeaseTakenOverByAnotherOwner() throws InterruptedException {
            // Given: our lease expires and another instance takes over
            Lease stale = lockManager.tryAcquire(SKU, SyncOperation.INVENTORY, Duration.ofMillis(50)).orElseThrow();
            Thread.sleep(80);
            LockManager other = new LockManager(store, Clock.systemUTC(), "other");
            assertThat(other.acquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(30))).isTrue();

            // When
            lockManager.release(stale);

            // Then
            assertThat(lockManager.isHeld(SKU, SyncOperation.INVENTORY)).isTrue();
        }

        @Test
        @DisplayName("Unconditional release clears the lease")
        void shouldReleaseByKey() {
            lockManager.acquire(SKU, SyncOperation.PRICE);

            lockManager.release(SKU, SyncOperation.PRICE);

            assertThat(lockManager.isHeld(SKU, SyncOperation.PRICE)).isFalse();
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Store failures")
    class StoreFailures {

        @Mock
        private CoordinationStore failingStore;

        @Test
        @DisplayName("Acquire propagates store failures instead of reporting contention")
        void shouldPropagateStoreFailureOnAcquire() {
            when(failingStore.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                    .thenThrow(new CoordinationStoreException("connection refused", null));
            LockManager manager = new LockManager(failingStore, Clock.systemUTC(), "test");

            assertThatThrownBy(() -> manager.tryAcquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(5)))
                    .isInstanceOf(CoordinationStoreException.class);
        }

        @Test
        @DisplayName("Release swallows store failures; TTL bounds the lease")
        void shouldSwallowStoreFailureOnRelease() {
            when(failingStore.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
            doThrow(new CoordinationStoreException("timeout", null))
                    .when(failingStore).deleteIfMatches(anyString(), anyString());
            LockManager manager = new LockManager(failingStore, Clock.systemUTC(), "test");
            Optional<Lease> lease = manager.tryAcquire(SKU, SyncOperation.INVENTORY, Duration.ofSeconds(5));

            manager.release(lease.orElseThrow());

            assertThat(lease).isPresent();
        }
    }
}
