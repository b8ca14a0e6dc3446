package com.commerce.sync.service.platform;

import lombok.Value;

/**
 * Result of a single platform write.
 */
@Value
public class WriteOutcome {

    Status status;
    String message;

    public static WriteOutcome success() {
        return new WriteOutcome(Status.SUCCESS, null);
    }

    public static WriteOutcome transientFailure(String message) {
        return new WriteOutcome(Status.TRANSIENT_FAILURE, message);
    }

    public static WriteOutcome permanentFailure(String message) {
        return new WriteOutcome(Status.PERMANENT_FAILURE, message);
    }

    /**
     * Maps an HTTP response code: 2xx succeeds, 429 and 5xx are transient, any other code is permanent.
     */
    public static WriteOutcome fromHttpStatus(int statusCode, String message) {
        if (statusCode >= 200 && statusCode < 300) {
            return success();
        }
        if (statusCode == 429 || statusCode >= 500) {
            return transientFailure(statusCode + " " + message);
        }
        return permanentFailure(statusCode + " " + message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isTransient() {
        return status == Status.TRANSIENT_FAILURE;
    }

    public enum Status {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }
}
