package com.commerce.sync.service.conflict;

import com.commerce.sync.domain.Conflict;
import com.commerce.sync.domain.Conflict.ConflictType;
import com.commerce.sync.domain.LedgerEntry;
import com.commerce.sync.domain.Observation;
import com.commerce.sync.domain.PricingTerms;
import com.commerce.sync.domain.Resolution;
import com.commerce.sync.domain.ResolutionStrategy;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.service.ledger.LedgerReader;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides the authoritative value when the two platforms disagree.
 * <p>
 * Quantities: a ledger transaction newer than the last sync wins; otherwise the lower quantity
 * wins so stock is never oversold.
 * <p>
 * Prices: the target price is checked against the price expected from the source price.
 * Small differences are ignored, a recent manual change is respected, anything else is
 * recalculated from the source.
 * <p>
 * Pure apart from the ledger reads. Ledger failures propagate.
 */
@Slf4j
public class ConflictResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 6;

    private final LedgerReader quantityLedger;
    private final LedgerReader priceLedger;
    private final PricePolicy pricePolicy;
    private final Clock clock;

    public ConflictResolver(LedgerReader quantityLedger, LedgerReader priceLedger, PricePolicy pricePolicy,
                            Clock clock) {
        this.quantityLedger = quantityLedger;
        this.priceLedger = priceLedger;
        this.pricePolicy = pricePolicy;
        this.clock = clock;
    }

    /**
     * @param lastSyncedAt last time the resource was fully synchronized, or null if unknown
     */
    public Resolution resolveQuantity(ResourceKey resourceKey, Observation first, Observation second,
                                      Instant lastSyncedAt) {
        Conflict conflict = Conflict.quantity(first, second);
        requireKey(resourceKey, conflict);
        return resolveQuantity(conflict, lastSyncedAt);
    }

    private Resolution resolveQuantity(Conflict conflict, Instant lastSyncedAt) {
        requireType(conflict, ConflictType.QUANTITY);
        Observation first = conflict.getFirst();
        Observation second = conflict.getSecond();
        if (first.sameValueAs(second)) {
            throw new IllegalArgumentException("Quantities for " + conflict.getResourceKey() + " agree; nothing to resolve");
        }

        Resolution.ResolutionBuilder resolution = Resolution.builder()
                .resourceKey(conflict.getResourceKey())
                .conflictType(ConflictType.QUANTITY)
                .observation(first)
                .observation(second)
                .input(first.getPlatform().name().toLowerCase(Locale.ROOT) + "Quantity", first.getValue())
                .input(second.getPlatform().name().toLowerCase(Locale.ROOT) + "Quantity", second.getValue())
                .referenceTime(lastSyncedAt)
                .resolvedAt(clock.instant());

        if (lastSyncedAt != null) {
            List<LedgerEntry> newer = quantityLedger.findLatestSince(conflict.getResourceKey(), lastSyncedAt);
            if (!newer.isEmpty()) {
                LedgerEntry latest = newer.get(0);
                log.info("Quantity conflict for {}: {} vs {}, ledger entry at {} wins with {}",
                        conflict.getResourceKey(), first.getValue(), second.getValue(),
                        latest.getRecordedAt(), latest.getNewValue());
                return resolution
                        .strategy(ResolutionStrategy.LATEST_TRANSACTION)
                        .resolvedValue(latest.getNewValue())
                        .writeRequired(true)
                        .ledgerEntries(newer)
                        .build();
            }
        }

        BigDecimal minimum = first.getValue().min(second.getValue());
        log.info("Quantity conflict for {}: {} vs {}, no newer ledger entry, keeping minimum {}",
                conflict.getResourceKey(), first.getValue(), second.getValue(), minimum);
        return resolution
                .strategy(ResolutionStrategy.CONSERVATIVE_MINIMUM)
                .resolvedValue(minimum)
                .writeRequired(true)
                .build();
    }

    public Resolution resolvePrice(ResourceKey resourceKey, Observation source, Observation target,
                                   PricingTerms terms) {
        Conflict conflict = Conflict.price(source, target);
        requireKey(resourceKey, conflict);
        return resolvePrice(conflict, terms);
    }

    private Resolution resolvePrice(Conflict conflict, PricingTerms terms) {
        requireType(conflict, ConflictType.PRICE);
        ResourceKey resourceKey = conflict.getResourceKey();
        Observation source = conflict.getFirst();
        Observation target = conflict.getSecond();
        BigDecimal observed = target.getValue();
        BigDecimal expected = terms.expectedTargetPrice(source.getValue());
        BigDecimal threshold = pricePolicy.getIgnoreThresholdPercent();
        Optional<BigDecimal> difference = percentDifference(observed, expected);

        Resolution.ResolutionBuilder resolution = Resolution.builder()
                .resourceKey(resourceKey)
                .conflictType(ConflictType.PRICE)
                .observation(source)
                .observation(target)
                .input("sourcePrice", source.getValue())
                .input("observedPrice", observed)
                .input("expectedPrice", expected)
                .input("exchangeRate", terms.getExchangeRate())
                .input("marginMultiplier", terms.getMarginMultiplier())
                .input("thresholdPercent", threshold)
                .resolvedAt(clock.instant());
        difference.ifPresent(pct -> resolution.input("percentDifference", pct));

        if (difference.isPresent() && difference.get().compareTo(threshold) < 0) {
            log.debug("Price difference for {} is {}%, under {}%; ignoring", resourceKey, difference.get(), threshold);
            return resolution
                    .strategy(ResolutionStrategy.IGNORE)
                    .resolvedValue(observed)
                    .writeRequired(false)
                    .build();
        }

        Optional<LedgerEntry> manual = priceLedger.findManualOverride(resourceKey, pricePolicy.getManualOverrideWindow());
        if (manual.isPresent()) {
            LedgerEntry entry = manual.get();
            log.info("Price conflict for {}: manual change at {} to {} takes priority", resourceKey,
                    entry.getRecordedAt(), entry.getNewValue());
            return resolution
                    .strategy(ResolutionStrategy.MANUAL_OVERRIDE)
                    .resolvedValue(entry.getNewValue())
                    .writeRequired(observed.compareTo(entry.getNewValue()) != 0)
                    .ledgerEntry(entry)
                    .build();
        }

        BigDecimal recalculated = terms.roundToMinorUnit(expected);
        log.info("Price conflict for {}: observed {}, expected {} ({}% off); recalculating from source",
                resourceKey, observed, recalculated, difference.map(BigDecimal::toPlainString).orElse("inf"));
        return resolution
                .strategy(ResolutionStrategy.RECALCULATE_FROM_SOURCE)
                .resolvedValue(recalculated)
                .writeRequired(observed.compareTo(recalculated) != 0)
                .build();
    }

    /**
     * |observed - expected| / expected * 100. Empty when the difference is unbounded (expected is
     * zero but observed is not).
     */
    static Optional<BigDecimal> percentDifference(BigDecimal observed, BigDecimal expected) {
        if (expected.signum() == 0) {
            return observed.signum() == 0 ? Optional.of(BigDecimal.ZERO) : Optional.empty();
        }
        return Optional.of(observed.subtract(expected).abs()
                .multiply(HUNDRED)
                .divide(expected.abs(), PERCENT_SCALE, RoundingMode.HALF_UP));
    }

    private static void requireType(Conflict conflict, ConflictType expected) {
        if (conflict.getType() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " conflict but got " + conflict.getType());
        }
    }

    private static void requireKey(ResourceKey resourceKey, Conflict conflict) {
        if (!resourceKey.equals(conflict.getResourceKey())) {
            throw new IllegalArgumentException("Observations belong to " + conflict.getResourceKey()
                    + ", not " + resourceKey);
        }
    }
}
