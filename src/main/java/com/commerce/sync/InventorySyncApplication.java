package com.commerce.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Inventory Sync Service
 * <p>
 * Keeps inventory quantities and prices consistent between a source and a target commerce
 * platform that share no transaction log.
 * <p>
 * Key Features:
 * - Per-resource leases in Redis so only one run touches a resource at a time
 * - Ledger-aware conflict resolution for quantities and prices
 * - Rate-limited bulk writes with retry, backoff and circuit breaking
 * - Run history, conflict log and metrics
 */
@SpringBootApplication
@EnableScheduling
public class InventorySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventorySyncApplication.class, args);
    }
}
