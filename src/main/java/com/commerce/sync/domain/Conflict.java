package com.commerce.sync.domain;

import lombok.Value;

/**
 * Two observations of the same resource that disagree. Only lives for the duration of resolution.
 * For price conflicts {@code first} is the source observation and {@code second} the target one.
 */
@Value
public class Conflict {

    ResourceKey resourceKey;
    ConflictType type;
    Observation first;
    Observation second;

    public static Conflict quantity(Observation first, Observation second) {
        return new Conflict(requireSameKey(first, second), ConflictType.QUANTITY, first, second);
    }

    public static Conflict price(Observation source, Observation target) {
        if (source.getPlatform() != Platform.SOURCE || target.getPlatform() != Platform.TARGET) {
            throw new IllegalArgumentException("Price conflicts pair a SOURCE observation with a TARGET observation");
        }
        return new Conflict(requireSameKey(source, target), ConflictType.PRICE, source, target);
    }

    private static ResourceKey requireSameKey(Observation first, Observation second) {
        if (!first.getResourceKey().equals(second.getResourceKey())) {
            throw new IllegalArgumentException("Observations belong to different resources: "
                    + first.getResourceKey() + " vs " + second.getResourceKey());
        }
        return first.getResourceKey();
    }

    public enum ConflictType {
        QUANTITY,
        PRICE
    }
}
