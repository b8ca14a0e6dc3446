package com.commerce.sync.service.resilience;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.exception.PlatformApiException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteCallGuardTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final RemoteCallGuard guard = new RemoteCallGuard(TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(100))
            .cancelRunningFuture(true)
            .build()), executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Returns the call's result")
    void shouldReturnResult() {
        assertThat(guard.call(Platform.SOURCE, "A", "getQuantity", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("A call that never returns times out as a retryable failure and is interrupted")
    void shouldTimeOutHangingCall() throws InterruptedException {
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> guard.call(Platform.TARGET, "A", "applyPrice", () -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return null;
        }))
                .isInstanceOfSatisfying(PlatformApiException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getPlatform()).isEqualTo(Platform.TARGET);
                });

        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("A slow write that timed out never lands afterwards")
    void shouldStopSlowWriteAfterTimeout() throws InterruptedException {
        AtomicBoolean landed = new AtomicBoolean(false);

        assertThatThrownBy(() -> guard.call(Platform.TARGET, "A", "applyQuantity", () -> {
            try {
                Thread.sleep(400);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            landed.set(true);
            return true;
        })).isInstanceOf(PlatformApiException.class);

        Thread.sleep(600);
        assertThat(landed).isFalse();
    }

    @Test
    @DisplayName("Exceptions thrown by the call pass through unchanged")
    void shouldPropagateCallFailure() {
        PlatformApiException failure = new PlatformApiException("400", Platform.TARGET, "A", false);

        assertThatThrownBy(() -> guard.call(Platform.TARGET, "A", "applyPrice", () -> {
            throw failure;
        })).isSameAs(failure);
    }
}
