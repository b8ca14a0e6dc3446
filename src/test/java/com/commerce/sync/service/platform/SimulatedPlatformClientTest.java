package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.exception.PlatformApiException;
import com.commerce.sync.exception.ResourceNotFoundOnPlatformException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedPlatformClientTest {

    private static final ResourceKey SKU = ResourceKey.of("SKU-1");

    private SimulatedPlatformClient client;

    @BeforeEach
    void setUp() {
        client = new SimulatedPlatformClient(Platform.TARGET, Clock.systemUTC(), 0.0, 0);
        client.setQuantity(SKU, BigDecimal.TEN);
        client.setPrice(SKU, new BigDecimal("19.99"));
    }

    @Test
    @DisplayName("Writes replace the stored value")
    void shouldApplyWrites() {
        assertThat(client.applyQuantity(SKU, new BigDecimal("7")).isSuccess()).isTrue();
        assertThat(client.applyPrice(SKU, new BigDecimal("21.50")).isSuccess()).isTrue();

        assertThat(client.getQuantity(SKU).getValue()).isEqualByComparingTo("7");
        assertThat(client.priceOf(SKU)).isEqualByComparingTo("21.50");
        assertThat(client.getWriteCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Invalid values, rejected keys and unknown keys fail permanently")
    void shouldRejectPermanently() {
        client.rejectWrites(SKU);

        assertThat(client.applyQuantity(SKU, new BigDecimal("-1")).getStatus())
                .isEqualTo(WriteOutcome.Status.PERMANENT_FAILURE);
        assertThat(client.applyPrice(SKU, BigDecimal.ZERO).getStatus())
                .isEqualTo(WriteOutcome.Status.PERMANENT_FAILURE);
        assertThat(client.applyQuantity(SKU, BigDecimal.ONE).getMessage()).startsWith("400");
        assertThat(client.applyQuantity(ResourceKey.of("OTHER"), BigDecimal.ONE).getMessage()).startsWith("404");
        assertThat(client.isResolvable(ResourceKey.of("OTHER"))).isFalse();
    }

    @Test
    @DisplayName("An outage fails reads with a retryable error and writes transiently")
    void shouldSimulateOutage() {
        client.setSimulateOutage(true);

        assertThatThrownBy(() -> client.getQuantity(SKU))
                .isInstanceOfSatisfying(PlatformApiException.class, e -> assertThat(e.isRetryable()).isTrue());
        assertThat(client.applyQuantity(SKU, BigDecimal.ONE).isTransient()).isTrue();
    }

    @Test
    @DisplayName("Reading an unknown key throws not found")
    void shouldThrowNotFound() {
        assertThatThrownBy(() -> client.getPrice(ResourceKey.of("MISSING")))
                .isInstanceOf(ResourceNotFoundOnPlatformException.class);
    }

    @Test
    @DisplayName("A write on an interrupted thread is abandoned without changing the value")
    void shouldAbandonWriteWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> client.applyQuantity(SKU, new BigDecimal("3")))
                    .isInstanceOfSatisfying(PlatformApiException.class, e -> assertThat(e.isRetryable()).isTrue());
        } finally {
            Thread.interrupted();
        }

        assertThat(client.getQuantity(SKU).getValue()).isEqualByComparingTo("10");
    }
}
