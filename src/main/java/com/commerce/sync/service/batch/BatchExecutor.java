package com.commerce.sync.service.batch;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.exception.PlatformApiException;
import com.commerce.sync.service.platform.PlatformWriter;
import com.commerce.sync.service.platform.WriteOutcome;
import com.commerce.sync.service.resilience.RemoteCallGuard;
import com.commerce.sync.service.resilience.RetryPolicies;
import com.commerce.sync.service.resilience.TransientFailureClassifier;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Applies writes to the platforms in rate-limited chunks.
 * <p>
 * Chunks are dispatched sequentially with {@link BatchOptions#getInterBatchDelay()} between
 * chunks that reached the network. Within a chunk:
 * <ul>
 *   <li>items whose value is already in place, or that the platform cannot resolve, are skipped</li>
 *   <li>permanent failures are recorded immediately and never retried</li>
 *   <li>transient failures retry the items still pending, with capped exponential backoff</li>
 *   <li>every call passes through the platform's circuit breaker and a time limit</li>
 * </ul>
 * Item failures end up in the report; they never escape as exceptions.
 */
@Slf4j
public class BatchExecutor {

    private static final String CIRCUIT_BREAKER_PREFIX = "platform-write-";

    private final Map<Platform, PlatformWriter> writers = new EnumMap<>(Platform.class);
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RemoteCallGuard guard;
    private final RetryPolicies retryPolicies;
    private final TransientFailureClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;

    public BatchExecutor(Collection<? extends PlatformWriter> writers,
                         CircuitBreakerRegistry circuitBreakerRegistry,
                         RemoteCallGuard guard,
                         RetryPolicies retryPolicies,
                         TransientFailureClassifier classifier,
                         Sleeper sleeper,
                         Clock clock) {
        for (PlatformWriter writer : writers) {
            if (this.writers.putIfAbsent(writer.platform(), writer) != null) {
                throw new IllegalArgumentException("More than one writer registered for " + writer.platform());
            }
        }
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.guard = guard;
        this.retryPolicies = retryPolicies;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public static String circuitBreakerName(Platform platform) {
        return CIRCUIT_BREAKER_PREFIX + platform.name().toLowerCase(Locale.ROOT);
    }

    public BatchRunReport execute(List<BatchItem> items, BatchOptions options) {
        return execute(items, options, CancellationSignal.none());
    }

    public BatchRunReport execute(List<BatchItem> items, BatchOptions options, CancellationSignal signal) {
        options.validate();
        Instant started = clock.instant();
        ReportAccumulator report = new ReportAccumulator(items.size());
        List<List<BatchItem>> chunks = partition(items, options.getBatchSize());
        Retry retry = retryPolicies.create("batch-write", options.getMaxRetries(), options.backoffPolicy());

        log.info("Executing {} writes in {} chunk(s) of up to {}", items.size(), chunks.size(),
                options.getBatchSize());

        boolean previousDispatched = false;
        boolean aborted = false;
        for (int index = 0; index < chunks.size(); index++) {
            List<BatchItem> chunk = chunks.get(index);
            if (aborted) {
                report.skipAll(chunk);
                continue;
            }

            if (previousDispatched && !options.getInterBatchDelay().isZero()) {
                pause(options.getInterBatchDelay(), signal);
            }
            if (signal.isCancelled()) {
                log.info("Batch cancelled before chunk {}/{}; skipping remaining items", index + 1, chunks.size());
                report.markCancelled();
                report.skipAll(chunk);
                aborted = true;
                continue;
            }

            int failedBefore = report.failedSoFar();
            previousDispatched = processChunk(chunk, retry, report);
            if (previousDispatched) {
                report.chunkDispatched();
            }
            log.debug("Chunk {}/{} done: {} new failure(s)", index + 1, chunks.size(),
                    report.failedSoFar() - failedBefore);

            if (options.isFailFast() && report.failedSoFar() > failedBefore) {
                log.warn("Chunk {}/{} had failures and fail-fast is set; skipping remaining items",
                        index + 1, chunks.size());
                aborted = true;
            }
        }

        BatchRunReport result = report.build(Duration.between(started, clock.instant()));
        log.info("Batch finished: total={}, succeeded={}, failed={}, skipped={}, cancelled={}, elapsed={} ms",
                result.getTotal(), result.getSucceeded(), result.getFailed(), result.getSkipped(),
                result.isCancelled(), result.getElapsed().toMillis());
        return result;
    }

    /**
     * @return true if at least one item reached the network
     */
    private boolean processChunk(List<BatchItem> chunk, Retry retry, ReportAccumulator report) {
        List<BatchItem> pending = new ArrayList<>();
        for (BatchItem item : chunk) {
            if (item.isNoOp()) {
                report.skipped();
                continue;
            }
            PlatformWriter writer = writers.get(item.getPlatform());
            if (writer == null) {
                report.failed(item, "No writer configured for " + item.getPlatform(), clock.instant());
                continue;
            }
            if (!writer.isResolvable(item.getResourceKey())) {
                log.debug("Skipping {} on {}: not resolvable", item.getResourceKey(), item.getPlatform());
                report.skipped();
                continue;
            }
            pending.add(item);
        }
        if (pending.isEmpty()) {
            return false;
        }

        try {
            retry.executeRunnable(() -> attemptPending(pending, report));
        } catch (RuntimeException e) {
            String message = describe(e);
            log.warn("{} item(s) still failing after retries: {}", pending.size(), message);
            Instant now = clock.instant();
            for (BatchItem item : pending) {
                report.failed(item, message, now);
            }
            pending.clear();
        }
        return true;
    }

    /**
     * Writes every pending item once. Settled items are removed from {@code pending}; if any
     * remain, throws a retryable exception so the retry policy runs another attempt.
     */
    private void attemptPending(List<BatchItem> pending, ReportAccumulator report) {
        BatchItem lastTransient = null;
        String lastMessage = null;
        Iterator<BatchItem> iterator = pending.iterator();
        while (iterator.hasNext()) {
            BatchItem item = iterator.next();
            WriteOutcome outcome = writeOne(item);
            switch (outcome.getStatus()) {
                case SUCCESS -> {
                    report.succeeded();
                    iterator.remove();
                }
                case PERMANENT_FAILURE -> {
                    report.failed(item, outcome.getMessage(), clock.instant());
                    iterator.remove();
                }
                case TRANSIENT_FAILURE -> {
                    lastTransient = item;
                    lastMessage = outcome.getMessage();
                }
            }
        }
        if (lastTransient != null) {
            throw new PlatformApiException(lastMessage, lastTransient.getPlatform(),
                    lastTransient.getResourceKey().value(), true);
        }
    }

    private WriteOutcome writeOne(BatchItem item) {
        Platform platform = item.getPlatform();
        PlatformWriter writer = writers.get(platform);
        String resourceKey = item.getResourceKey().value();
        String callName = item.getOperation() == SyncOperation.INVENTORY ? "applyQuantity" : "applyPrice";
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(circuitBreakerName(platform));

        try {
            return circuitBreaker.executeSupplier(() -> {
                WriteOutcome outcome = guard.call(platform, resourceKey, callName, () -> apply(writer, item));
                if (outcome.isTransient()) {
                    // Thrown so the breaker records it; converted back below.
                    throw new PlatformApiException(outcome.getMessage(), platform, resourceKey, true);
                }
                return outcome;
            });
        } catch (CallNotPermittedException e) {
            return WriteOutcome.permanentFailure("circuit breaker open for " + platform);
        } catch (RuntimeException e) {
            return classifier.isTransient(e)
                    ? WriteOutcome.transientFailure(describe(e))
                    : WriteOutcome.permanentFailure(describe(e));
        }
    }

    private WriteOutcome apply(PlatformWriter writer, BatchItem item) {
        return item.getOperation() == SyncOperation.INVENTORY
                ? writer.applyQuantity(item.getResourceKey(), item.getNewValue())
                : writer.applyPrice(item.getResourceKey(), item.getNewValue());
    }

    private void pause(Duration delay, CancellationSignal signal) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted during inter-batch delay; cancelling remaining chunks");
            signal.cancel();
        }
    }

    private static String describe(Throwable e) {
        return Objects.toString(e.getMessage(), e.getClass().getSimpleName());
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(items.subList(start, Math.min(start + size, items.size())));
        }
        return chunks;
    }
}
