package com.commerce.sync.service.batch;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.service.platform.PlatformWriter;
import com.commerce.sync.service.platform.WriteOutcome;
import com.commerce.sync.service.resilience.RemoteCallGuard;
import com.commerce.sync.service.resilience.RetryPolicies;
import com.commerce.sync.service.resilience.TransientFailureClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchExecutorTest {

    private final TransientFailureClassifier classifier = new TransientFailureClassifier();
    private final ExecutorService callExecutor = Executors.newCachedThreadPool();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private ScriptedWriter writer;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private BatchExecutor batchExecutor;

    @BeforeEach
    void setUp() {
        writer = new ScriptedWriter();
        circuitBreakerRegistry = registryWithThreshold(5);
        batchExecutor = executor(sleeps::add);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    private CircuitBreakerRegistry registryWithThreshold(int threshold) {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordException(classifier::isTransient)
                .build());
    }

    private BatchExecutor executor(Sleeper sleeper) {
        return new BatchExecutor(List.of(writer), circuitBreakerRegistry,
                new RemoteCallGuard(TimeLimiter.of(Duration.ofSeconds(2)), callExecutor),
                new RetryPolicies(classifier), classifier, sleeper, Clock.systemUTC());
    }

    private static BatchOptions.BatchOptionsBuilder fastOptions() {
        return BatchOptions.builder()
                .interBatchDelay(Duration.ofMillis(10))
                .backoffBase(Duration.ofMillis(1))
                .backoffCap(Duration.ofMillis(5))
                .maxRetries(2);
    }

    private static BatchItem item(String key) {
        return BatchItem.builder()
                .resourceKey(ResourceKey.of(key))
                .platform(Platform.TARGET)
                .operation(SyncOperation.INVENTORY)
                .newValue(BigDecimal.TEN)
                .build();
    }

    private static List<BatchItem> items(int count) {
        List<BatchItem> items = new ArrayList<>();
        IntStream.range(0, count).forEach(i -> items.add(item("SKU-" + i)));
        return items;
    }

    @Nested
    @DisplayName("Chunking")
    class ChunkingTests {

        @Test
        @DisplayName("Permanent failures in one chunk do not stop the other chunks")
        void shouldContinueAfterPermanentFailuresInOneChunk() {
            // Given
            List<BatchItem> items = items(250);
            items.subList(100, 200).forEach(item ->
                    writer.script(item.getResourceKey(), WriteOutcome.permanentFailure("400 rejected")));

            // When
            BatchRunReport report = batchExecutor.execute(items, fastOptions().batchSize(100).build());

            // Then
            assertThat(report.getTotal()).isEqualTo(250);
            assertThat(report.getSucceeded()).isEqualTo(150);
            assertThat(report.getFailed()).isEqualTo(100);
            assertThat(report.getSkipped()).isZero();
            assertThat(report.getChunksDispatched()).isEqualTo(3);
            assertThat(report.getFailures()).allSatisfy(failure ->
                    assertThat(failure.getMessage()).isEqualTo("400 rejected"));
            assertThat(writer.writes()).isEqualTo(250);
            assertThat(sleeps).hasSize(2);
        }

        @Test
        @DisplayName("Permanent failures alone never open the circuit breaker")
        void shouldNotTripBreakerOnPermanentFailures() {
            // Given
            writer.fallback(WriteOutcome.permanentFailure("422 invalid"));

            // When
            BatchRunReport report = batchExecutor.execute(items(20), fastOptions().build());

            // Then
            assertThat(report.getFailed()).isEqualTo(20);
            assertThat(writer.writes()).isEqualTo(20);
            assertThat(breaker().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("No delay is taken before the first chunk or when the delay is zero")
        void shouldSkipDelayWhenZero() {
            batchExecutor.execute(items(5), fastOptions().batchSize(2).interBatchDelay(Duration.ZERO).build());

            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("partition keeps order and leaves a short last chunk")
        void shouldPartitionInOrder() {
            List<List<Integer>> chunks = BatchExecutor.partition(List.of(1, 2, 3, 4, 5), 2);

            assertThat(chunks).containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
            assertThat(BatchExecutor.partition(List.of(), 3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("A transient failure is retried until it succeeds")
        void shouldRetryTransientFailure() {
            // Given
            ResourceKey key = ResourceKey.of("SKU-1");
            writer.script(key, WriteOutcome.transientFailure("503 unavailable"),
                    WriteOutcome.transientFailure("429 throttled"));

            // When
            BatchRunReport report = batchExecutor.execute(List.of(item("SKU-1")), fastOptions().build());

            // Then
            assertThat(report.getSucceeded()).isEqualTo(1);
            assertThat(report.getFailed()).isZero();
            assertThat(writer.writesFor(key)).isEqualTo(3);
        }

        @Test
        @DisplayName("Only the items still failing are retried")
        void shouldRetryOnlyPendingItems() {
            // Given
            writer.script(ResourceKey.of("SKU-2"), WriteOutcome.transientFailure("503 unavailable"));

            // When
            BatchRunReport report = batchExecutor.execute(items(3), fastOptions().build());

            // Then
            assertThat(report.getSucceeded()).isEqualTo(3);
            assertThat(writer.writesFor(ResourceKey.of("SKU-0"))).isEqualTo(1);
            assertThat(writer.writesFor(ResourceKey.of("SKU-2"))).isEqualTo(2);
        }

        @Test
        @DisplayName("An item still failing after the last retry is reported with the last error")
        void shouldFailAfterExhaustingRetries() {
            // Given
            writer.fallback(WriteOutcome.transientFailure("503 unavailable"));

            // When
            BatchRunReport report = batchExecutor.execute(List.of(item("SKU-1")), fastOptions().maxRetries(2).build());

            // Then
            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getFailures()).singleElement().satisfies(failure -> {
                assertThat(failure.getResourceKey()).isEqualTo(ResourceKey.of("SKU-1"));
                assertThat(failure.getPlatform()).isEqualTo(Platform.TARGET);
                assertThat(failure.getMessage()).isEqualTo("503 unavailable");
            });
            assertThat(writer.writes()).isEqualTo(3);
        }

        @Test
        @DisplayName("A permanent failure is never retried")
        void shouldNotRetryPermanentFailure() {
            writer.script(ResourceKey.of("SKU-1"), WriteOutcome.permanentFailure("404 unknown"));

            BatchRunReport report = batchExecutor.execute(List.of(item("SKU-1")), fastOptions().build());

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(writer.writes()).isEqualTo(1);
        }

        @Test
        @DisplayName("A writer exception is classified like a failed outcome")
        void shouldClassifyWriterExceptions() {
            writer.throwOn(ResourceKey.of("SKU-1"), new IllegalStateException("mapping bug"));

            BatchRunReport report = batchExecutor.execute(List.of(item("SKU-1")), fastOptions().build());

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getFailures().get(0).getMessage()).isEqualTo("mapping bug");
            assertThat(writer.writes()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreakerTests {

        @Test
        @DisplayName("Consecutive transient failures open the breaker and later items fail fast")
        void shouldOpenBreakerAfterConsecutiveFailures() {
            // Given
            circuitBreakerRegistry = registryWithThreshold(3);
            batchExecutor = executor(sleeps::add);
            writer.fallback(WriteOutcome.transientFailure("503 unavailable"));

            // When
            BatchRunReport report = batchExecutor.execute(items(5), fastOptions().maxRetries(0).build());

            // Then
            assertThat(breaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(writer.writes()).isEqualTo(3);
            assertThat(report.getFailed()).isEqualTo(5);
            assertThat(report.getFailures())
                    .filteredOn(failure -> failure.getMessage().equals("circuit breaker open for TARGET"))
                    .hasSize(2);
        }

        @Test
        @DisplayName("A successful trial call in half-open closes the breaker")
        void shouldCloseBreakerAfterSuccessfulTrial() {
            // Given
            breaker().transitionToOpenState();
            breaker().transitionToHalfOpenState();

            // When
            BatchRunReport report = batchExecutor.execute(List.of(item("SKU-1")), fastOptions().build());

            // Then
            assertThat(report.getSucceeded()).isEqualTo(1);
            assertThat(breaker().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("An open breaker rejects writes without calling the platform")
        void shouldRejectWhileOpen() {
            breaker().transitionToOpenState();

            BatchRunReport report = batchExecutor.execute(items(2), fastOptions().build());

            assertThat(report.getFailed()).isEqualTo(2);
            assertThat(writer.writes()).isZero();
        }
    }

    @Nested
    @DisplayName("Skips and cancellation")
    class SkipAndCancelTests {

        @Test
        @DisplayName("Items already holding the new value and unresolvable items are skipped")
        void shouldSkipNoOpAndUnresolvableItems() {
            // Given
            BatchItem noOp = item("SKU-0").toBuilder().currentValue(new BigDecimal("10.00")).build();
            writer.unresolvable(ResourceKey.of("SKU-1"));

            // When
            BatchRunReport report = batchExecutor.execute(List.of(noOp, item("SKU-1"), item("SKU-2")),
                    fastOptions().build());

            // Then
            assertThat(report.getSkipped()).isEqualTo(2);
            assertThat(report.getSucceeded()).isEqualTo(1);
            assertThat(writer.writes()).isEqualTo(1);
        }

        @Test
        @DisplayName("An item for a platform without a writer fails")
        void shouldFailItemWithoutWriter() {
            BatchItem sourceItem = item("SKU-1").toBuilder().platform(Platform.SOURCE).build();

            BatchRunReport report = batchExecutor.execute(List.of(sourceItem), fastOptions().build());

            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getFailures().get(0).getMessage()).isEqualTo("No writer configured for SOURCE");
        }

        @Test
        @DisplayName("Cancelling during the inter-batch delay skips the remaining chunks")
        void shouldStopDispatchingWhenCancelled() {
            // Given
            CancellationSignal signal = new CancellationSignal();
            batchExecutor = executor(duration -> signal.cancel());

            // When
            BatchRunReport report = batchExecutor.execute(items(30), fastOptions().batchSize(10).build(), signal);

            // Then
            assertThat(report.isCancelled()).isTrue();
            assertThat(report.getSucceeded()).isEqualTo(10);
            assertThat(report.getSkipped()).isEqualTo(20);
            assertThat(report.getChunksDispatched()).isEqualTo(1);
        }

        @Test
        @DisplayName("An interrupt during the inter-batch delay cancels the run and keeps the interrupt flag")
        void shouldCancelOnInterrupt() {
            // Given
            batchExecutor = executor(duration -> {
                throw new InterruptedException("shutdown");
            });

            // When
            BatchRunReport report = batchExecutor.execute(items(4), fastOptions().batchSize(2).build());

            // Then
            assertThat(Thread.interrupted()).isTrue();
            assertThat(report.isCancelled()).isTrue();
            assertThat(report.getSucceeded()).isEqualTo(2);
            assertThat(report.getSkipped()).isEqualTo(2);
        }

        @Test
        @DisplayName("Fail-fast skips the chunks after the first chunk with a failure")
        void shouldSkipRemainingChunksOnFailFast() {
            // Given
            writer.script(ResourceKey.of("SKU-1"), WriteOutcome.permanentFailure("400 rejected"));

            // When
            BatchRunReport report = batchExecutor.execute(items(6),
                    fastOptions().batchSize(2).failFast(true).build());

            // Then
            assertThat(report.getSucceeded()).isEqualTo(1);
            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getSkipped()).isEqualTo(4);
            assertThat(report.isCancelled()).isFalse();
        }

        @Test
        @DisplayName("An empty batch produces an empty report")
        void shouldHandleEmptyBatch() {
            BatchRunReport report = batchExecutor.execute(List.of(), fastOptions().build());

            assertThat(report.getTotal()).isZero();
            assertThat(report.getChunksDispatched()).isZero();
            assertThat(writer.writes()).isZero();
        }
    }

    private CircuitBreaker breaker() {
        return circuitBreakerRegistry.circuitBreaker(BatchExecutor.circuitBreakerName(Platform.TARGET));
    }

    private static class ScriptedWriter implements PlatformWriter {

        private final Map<ResourceKey, Deque<WriteOutcome>> scripts = new ConcurrentHashMap<>();
        private final Map<ResourceKey, RuntimeException> failures = new ConcurrentHashMap<>();
        private final Map<ResourceKey, AtomicInteger> writesPerKey = new ConcurrentHashMap<>();
        private final Set<ResourceKey> unresolvable = ConcurrentHashMap.newKeySet();
        private final AtomicInteger writes = new AtomicInteger();
        private volatile WriteOutcome fallback = WriteOutcome.success();

        void script(ResourceKey key, WriteOutcome... outcomes) {
            scripts.computeIfAbsent(key, k -> new ConcurrentLinkedDeque<>()).addAll(List.of(outcomes));
        }

        void throwOn(ResourceKey key, RuntimeException failure) {
            failures.put(key, failure);
        }

        void fallback(WriteOutcome outcome) {
            this.fallback = outcome;
        }

        void unresolvable(ResourceKey key) {
            unresolvable.add(key);
        }

        int writes() {
            return writes.get();
        }

        int writesFor(ResourceKey key) {
            AtomicInteger count = writesPerKey.get(key);
            return count == null ? 0 : count.get();
        }

        @Override
        public Platform platform() {
            return Platform.TARGET;
        }

        @Override
        public WriteOutcome applyQuantity(ResourceKey resourceKey, BigDecimal quantity) {
            return next(resourceKey);
        }

        @Override
        public WriteOutcome applyPrice(ResourceKey resourceKey, BigDecimal price) {
            return next(resourceKey);
        }

        @Override
        public boolean isResolvable(ResourceKey resourceKey) {
            return !unresolvable.contains(resourceKey);
        }

        private WriteOutcome next(ResourceKey key) {
            writes.incrementAndGet();
            writesPerKey.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            RuntimeException failure = failures.get(key);
            if (failure != null) {
                throw failure;
            }
            Deque<WriteOutcome> script = scripts.get(key);
            WriteOutcome scripted = script == null ? null : script.poll();
            return scripted != null ? scripted : fallback;
        }
    }
}
