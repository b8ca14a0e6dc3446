package com.commerce.sync.service.resilience;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.exception.PlatformApiException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds every platform call with a timeout so a call that never returns cannot hang a run.
 * The call runs on a dedicated executor as a {@code FutureTask}; once the time limit passes the
 * task is cancelled and its worker thread interrupted, so a timed-out write cannot land later.
 */
@Slf4j
public class RemoteCallGuard {

    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public RemoteCallGuard(TimeLimiter timeLimiter, ExecutorService executor) {
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public <T> T call(Platform platform, String resourceKey, String operation, Supplier<T> call) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(call::get));
        } catch (TimeoutException e) {
            log.warn("{} call {} for {} timed out after {}", platform, operation, resourceKey,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new PlatformApiException(operation + " timed out on " + platform, platform, resourceKey, true, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformApiException(operation + " interrupted on " + platform, platform, resourceKey, false, e);
        } catch (Exception e) {
            throw new PlatformApiException(operation + " failed on " + platform + ": " + e.getMessage(),
                    platform, resourceKey, false, e);
        }
    }
}
