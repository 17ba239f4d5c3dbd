package com.planforge.core.orchestrator;

import com.planforge.common.constants.FailureClassification;
import com.planforge.core.attempt.RejectionReason;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Terminal result of one orchestrated request, mirrored by the terminal event on the channel.
 */
@Value
@Builder
public class GenerationOutcome {

    public enum Status { SUCCESS, FAILURE, CANCELLED, REJECTED }

    Status status;
    UUID planId;
    UUID attemptId;
    int attemptNumber;
    FailureClassification classification;
    RejectionReason rejectionReason;
    boolean retryable;
    int modulesCount;
    int tasksCount;
    long durationMs;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
