package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Observation;
import lombok.Value;

/**
 * Outcome of reading one side after retries: an observation, a definite "not found", or
 * unavailable (retries exhausted or a non-retryable error).
 */
@Value
public class ReadResult {

    Status status;
    Observation observation;
    String message;

    public static ReadResult ok(Observation observation) {
        return new ReadResult(Status.OK, observation, null);
    }

    public static ReadResult notFound(String message) {
        return new ReadResult(Status.NOT_FOUND, null, message);
    }

    public static ReadResult unavailable(String message) {
        return new ReadResult(Status.UNAVAILABLE, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public enum Status {
        OK,
        NOT_FOUND,
        UNAVAILABLE
    }
}
