package com.commerce.sync.config;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.PricingTerms;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.service.catalog.ProductCatalog;
import com.commerce.sync.service.platform.SimulatedPlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Platform clients. Both sides are simulated in memory; a real deployment replaces these beans
 * with HTTP clients implementing the same interfaces.
 */
@Configuration
@Slf4j
public class PlatformConfig {

    @Value("${sync.simulation.failure-rate:0.05}")
    private double failureRate;

    @Value("${sync.simulation.latency-ms:50}")
    private int latencyMs;

    @Value("${sync.simulation.seed-demo-data:false}")
    private boolean seedDemoData;

    @Bean
    public SimulatedPlatformClient sourcePlatform(Clock clock, ProductCatalog catalog) {
        SimulatedPlatformClient client = new SimulatedPlatformClient(Platform.SOURCE, clock, failureRate, latencyMs);
        if (seedDemoData) {
            seed(client, catalog, 0);
        }
        return client;
    }

    @Bean
    public SimulatedPlatformClient targetPlatform(Clock clock, ProductCatalog catalog) {
        SimulatedPlatformClient client = new SimulatedPlatformClient(Platform.TARGET, clock, failureRate, latencyMs);
        if (seedDemoData) {
            seed(client, catalog, 2);
        }
        return client;
    }

    /**
     * Seeds every catalog key with slightly divergent data so the first runs have conflicts to resolve.
     */
    private void seed(SimulatedPlatformClient client, ProductCatalog catalog, int drift) {
        List<ResourceKey> keys = catalog.activeResourceKeys();
        for (int i = 0; i < keys.size(); i++) {
            ResourceKey key = keys.get(i);
            BigDecimal sourcePrice = BigDecimal.valueOf(1000L + 100L * i);
            client.setQuantity(key, BigDecimal.valueOf(10L + i - (i % 2 == 0 ? drift : 0)));
            if (client.platform() == Platform.SOURCE) {
                client.setPrice(key, sourcePrice);
            } else {
                PricingTerms terms = catalog.pricingTermsFor(key);
                BigDecimal expected = terms.roundToMinorUnit(terms.expectedTargetPrice(sourcePrice));
                client.setPrice(key, i % 3 == 0 ? expected.add(BigDecimal.TEN) : expected);
            }
        }
        log.info("Seeded {} demo resource(s) on {}", keys.size(), client.platform());
    }
}
