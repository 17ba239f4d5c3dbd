package com.planforge.core.attempt;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RejectionReason {
    /** The plan has used up its attempt budget. Terminal. */
    CAPPED("capped"),
    /** Another attempt for the plan is still running. Wait, then check status. */
    IN_PROGRESS("in_progress");

    @JsonValue
    private final String value;
}
