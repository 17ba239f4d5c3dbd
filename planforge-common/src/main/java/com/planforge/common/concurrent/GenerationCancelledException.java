package com.planforge.common.concurrent;

import lombok.Getter;

/**
 * Raised when work is abandoned because its {@link CancellationToken} fired.
 * Never reclassified as a parse or provider failure.
 */
@Getter
public class GenerationCancelledException extends RuntimeException {

    private final CancellationReason reason;

    public GenerationCancelledException(CancellationReason reason) {
        super(reason == CancellationReason.TIMEOUT ? "Generation timed out" : "Generation cancelled");
        this.reason = reason;
    }

    public boolean isTimeout() {
        return reason == CancellationReason.TIMEOUT;
    }
}
