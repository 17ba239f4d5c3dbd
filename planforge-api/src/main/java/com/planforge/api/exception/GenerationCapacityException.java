package com.planforge.api.exception;

import lombok.Getter;

/**
 * Every stream slot is taken. Raised before reservation, so no attempt is consumed.
 */
@Getter
public class GenerationCapacityException extends RuntimeException {

    private final long retryAfterSeconds;

    public GenerationCapacityException(int maxStreams, long retryAfterSeconds) {
        super("All " + maxStreams + " generation streams are busy");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
