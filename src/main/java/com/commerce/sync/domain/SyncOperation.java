package com.commerce.sync.domain;

/**
 * Kind of value a sync run reconciles. Also scopes leases, so an inventory run and a price run
 * for the same resource never block each other.
 */
public enum SyncOperation {
    INVENTORY("inventory"),
    PRICE("price");

    private final String lockName;

    SyncOperation(String lockName) {
        this.lockName = lockName;
    }

    public String getLockName() {
        return lockName;
    }
}
