package com.commerce.sync.config;

import com.commerce.sync.domain.LedgerEntry.LedgerKind;
import com.commerce.sync.repository.LedgerEntryRepository;
import com.commerce.sync.service.SyncEventListener;
import com.commerce.sync.service.SyncOrchestrator;
import com.commerce.sync.service.batch.BatchExecutor;
import com.commerce.sync.service.batch.BatchOptions;
import com.commerce.sync.service.batch.Sleeper;
import com.commerce.sync.service.catalog.ProductCatalog;
import com.commerce.sync.service.checkpoint.SyncCheckpoints;
import com.commerce.sync.service.conflict.ConflictResolver;
import com.commerce.sync.service.conflict.PricePolicy;
import com.commerce.sync.service.ledger.JpaLedgerReader;
import com.commerce.sync.service.ledger.LedgerReader;
import com.commerce.sync.service.lock.CoordinationStore;
import com.commerce.sync.service.lock.LockManager;
import com.commerce.sync.service.platform.PlatformReadService;
import com.commerce.sync.service.platform.PlatformReader;
import com.commerce.sync.service.platform.PlatformWriter;
import com.commerce.sync.service.platform.ReadRetryOptions;
import com.commerce.sync.service.resilience.RemoteCallGuard;
import com.commerce.sync.service.resilience.RetryPolicies;
import com.commerce.sync.service.resilience.TransientFailureClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Wires the synchronization core. Every tunable comes from {@code sync.*} properties.
 */
@Configuration
@Slf4j
public class SyncConfig {

    @Value("${sync.instance-id:}")
    private String instanceId;

    @Value("${sync.lock.ttl:120s}")
    private Duration leaseTtl;

    @Value("${sync.batch.size:100}")
    private int batchSize;

    @Value("${sync.batch.inter-batch-delay:1s}")
    private Duration interBatchDelay;

    @Value("${sync.batch.max-retries:3}")
    private int maxRetries;

    @Value("${sync.batch.fail-fast:false}")
    private boolean failFast;

    @Value("${sync.batch.backoff-base:1s}")
    private Duration backoffBase;

    @Value("${sync.batch.backoff-cap:30s}")
    private Duration backoffCap;

    @Value("${sync.batch.jitter-factor:0.5}")
    private double jitterFactor;

    @Value("${sync.read.max-retries:3}")
    private int readMaxRetries;

    @Value("${sync.read.backoff-base:1s}")
    private Duration readBackoffBase;

    @Value("${sync.read.backoff-cap:60s}")
    private Duration readBackoffCap;

    @Value("${sync.price.ignore-threshold-percent:5}")
    private BigDecimal ignoreThresholdPercent;

    @Value("${sync.price.manual-override-window:24h}")
    private Duration manualOverrideWindow;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LockManager lockManager(CoordinationStore coordinationStore, Clock clock) {
        String id = instanceId == null || instanceId.isBlank()
                ? "sync-" + UUID.randomUUID().toString().substring(0, 8)
                : instanceId;
        log.info("Lock manager instance id {}, lease TTL {}", id, leaseTtl);
        return new LockManager(coordinationStore, clock, id);
    }

    @Bean
    public BatchOptions batchOptions() {
        return BatchOptions.builder()
                .batchSize(batchSize)
                .interBatchDelay(interBatchDelay)
                .maxRetries(maxRetries)
                .failFast(failFast)
                .backoffBase(backoffBase)
                .backoffCap(backoffCap)
                .jitterFactor(jitterFactor)
                .build();
    }

    @Bean
    public PricePolicy pricePolicy() {
        return PricePolicy.builder()
                .ignoreThresholdPercent(ignoreThresholdPercent)
                .manualOverrideWindow(manualOverrideWindow)
                .build();
    }

    @Bean
    public LedgerReader quantityLedgerReader(LedgerEntryRepository repository, Clock clock) {
        return new JpaLedgerReader(repository, LedgerKind.QUANTITY, clock);
    }

    @Bean
    public LedgerReader priceLedgerReader(LedgerEntryRepository repository, Clock clock) {
        return new JpaLedgerReader(repository, LedgerKind.PRICE, clock);
    }

    @Bean
    public ConflictResolver conflictResolver(@Qualifier("quantityLedgerReader") LedgerReader quantityLedgerReader,
                                             @Qualifier("priceLedgerReader") LedgerReader priceLedgerReader,
                                             PricePolicy pricePolicy, Clock clock) {
        return new ConflictResolver(quantityLedgerReader, priceLedgerReader, pricePolicy, clock);
    }

    @Bean
    public PlatformReadService platformReadService(List<PlatformReader> readers, RetryPolicies retryPolicies,
                                                   RemoteCallGuard remoteCallGuard) {
        ReadRetryOptions options = ReadRetryOptions.builder()
                .maxRetries(readMaxRetries)
                .backoffBase(readBackoffBase)
                .backoffCap(readBackoffCap)
                .jitterFactor(jitterFactor)
                .build();
        return new PlatformReadService(readers, retryPolicies, remoteCallGuard, options);
    }

    @Bean
    public BatchExecutor batchExecutor(List<PlatformWriter> writers,
                                       CircuitBreakerRegistry circuitBreakerRegistry,
                                       RemoteCallGuard remoteCallGuard,
                                       RetryPolicies retryPolicies,
                                       TransientFailureClassifier classifier,
                                       Clock clock) {
        return new BatchExecutor(writers, circuitBreakerRegistry, remoteCallGuard, retryPolicies, classifier,
                Sleeper.THREAD, clock);
    }

    @Bean
    public SyncOrchestrator syncOrchestrator(LockManager lockManager,
                                             PlatformReadService platformReadService,
                                             ConflictResolver conflictResolver,
                                             BatchExecutor batchExecutor,
                                             ProductCatalog productCatalog,
                                             SyncCheckpoints syncCheckpoints,
                                             List<SyncEventListener> listeners,
                                             BatchOptions batchOptions,
                                             Clock clock) {
        return new SyncOrchestrator(lockManager, platformReadService, conflictResolver, batchExecutor,
                productCatalog, syncCheckpoints, listeners, batchOptions, leaseTtl, clock);
    }
}
