package com.commerce.sync.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a conflict was decided. The code is what gets logged and persisted.
 */
public enum ResolutionStrategy {

    /**
     * A ledger entry newer than the last sync carries the authoritative quantity.
     */
    LATEST_TRANSACTION("latest_transaction"),

    /**
     * No newer ledger entry; the lower quantity wins so stock is never oversold.
     */
    CONSERVATIVE_MINIMUM("conservative_minimum"),

    /**
     * Price difference under the tolerance threshold; nothing to write.
     */
    IGNORE("ignore"),

    /**
     * A recent manual price change wins over automation.
     */
    MANUAL_OVERRIDE("manual_override"),

    /**
     * Price recomputed from the source price, exchange rate and margin.
     */
    RECALCULATE_FROM_SOURCE("recalculate_from_source");

    private final String code;

    ResolutionStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
