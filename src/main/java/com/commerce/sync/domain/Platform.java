package com.commerce.sync.domain;

/**
 * The two systems of record kept in sync.
 */
public enum Platform {
    /**
     * Platform where prices originate (priced in the source currency).
     */
    SOURCE,

    /**
     * Platform whose prices are derived from the source price via exchange rate and margin.
     */
    TARGET;

    public Platform other() {
        return this == SOURCE ? TARGET : SOURCE;
    }
}
