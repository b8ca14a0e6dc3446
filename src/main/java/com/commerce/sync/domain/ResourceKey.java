package com.commerce.sync.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier shared by both platforms for one tradable unit (typically a SKU).
 * <p>
 * Keys are canonicalized on construction: all whitespace is removed and the result is
 * upper-cased. Two raw keys that differ only in case or whitespace therefore compare equal,
 * lock the same lease and read the same ledger entries.
 */
@EqualsAndHashCode
public final class ResourceKey implements Comparable<ResourceKey> {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String value;

    private ResourceKey(String value) {
        this.value = value;
    }

    @JsonCreator
    public static ResourceKey of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Resource key must not be null");
        }
        String canonical = WHITESPACE.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (canonical.isEmpty()) {
            throw new IllegalArgumentException("Resource key must not be blank");
        }
        return new ResourceKey(canonical);
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public int compareTo(ResourceKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
