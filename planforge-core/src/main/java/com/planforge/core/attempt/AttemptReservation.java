package com.planforge.core.attempt;

import com.planforge.core.input.SanitizedInput;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof of an exclusive, in-progress attempt. Required to finalize it.
 */
@Value
@Builder
public class AttemptReservation {
    UUID attemptId;
    int attemptNumber;
    UUID planId;
    UUID userId;
    SanitizedInput input;
    String promptHash;
    Instant startedAt;
}
