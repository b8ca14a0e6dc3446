package com.commerce.sync.service.resilience;

import com.commerce.sync.exception.PlatformApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed remote call is worth retrying.
 * <p>
 * Transient: platform errors flagged retryable (429, 5xx), timeouts and I/O failures such as
 * connection reset or refused. Everything else, including calls rejected by an open circuit
 * breaker, is permanent.
 */
@Component
public class TransientFailureClassifier {

    public boolean isTransient(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CallNotPermittedException) {
            return false;
        }
        if (cause instanceof PlatformApiException) {
            return ((PlatformApiException) cause).isRetryable();
        }
        return cause instanceof TimeoutException || cause instanceof IOException;
    }

    private Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException
                || current instanceof UncheckedIOException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
