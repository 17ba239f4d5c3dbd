package com.planforge.api.dto.response;

import com.planforge.core.status.PlanStatusView;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class PlanStatusResponse {
    private UUID planId;
    private String status;
    private long attempts;
    private int attemptCap;
    private String latestClassification;
    private String latestError;
    private boolean retryable;
    private Instant updatedAt;

    public static PlanStatusResponse from(PlanStatusView view) {
        return PlanStatusResponse.builder()
            .planId(view.getPlanId())
            .status(view.getStatus().getValue())
            .attempts(view.getAttempts())
            .attemptCap(view.getAttemptCap())
            .latestClassification(view.getLatestClassification() != null ? view.getLatestClassification().getValue() : null)
            .latestError(view.getLatestError())
            .retryable(view.isRetryable())
            .updatedAt(view.getUpdatedAt())
            .build();
    }
}
