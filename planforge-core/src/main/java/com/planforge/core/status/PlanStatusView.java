package com.planforge.core.status;

import com.fasterxml.jackson.annotation.JsonValue;
import com.planforge.common.constants.FailureClassification;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PlanStatusView {

    @Getter
    @RequiredArgsConstructor
    public enum Status {
        PENDING("pending"),
        PROCESSING("processing"),
        READY("ready"),
        FAILED("failed");

        @JsonValue
        private final String value;
    }

    UUID planId;
    Status status;
    long attempts;
    int attemptCap;
    FailureClassification latestClassification;
    /** User-facing message for the latest failure; null unless the plan is failed. */
    String latestError;
    /** Whether a new generation request could be accepted right now. */
    boolean retryable;
    Instant updatedAt;
}
