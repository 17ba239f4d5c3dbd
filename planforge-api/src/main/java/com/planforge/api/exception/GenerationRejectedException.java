package com.planforge.api.exception;

import com.planforge.core.attempt.ReservationResult;
import lombok.Getter;

import java.util.UUID;

/**
 * A generation request the ledger declined to reserve. Raised before any stream is opened.
 */
@Getter
public class GenerationRejectedException extends RuntimeException {

    private final UUID planId;
    private final transient ReservationResult result;

    public GenerationRejectedException(UUID planId, ReservationResult result) {
        super("Generation rejected for plan " + planId + ": " + result.getRejectionReason().getValue());
        this.planId = planId;
        this.result = result;
    }
}
