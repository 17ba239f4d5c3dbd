package com.planforge.core.status;

import com.planforge.common.constants.AttemptStatus;
import com.planforge.common.constants.FailureClassification;
import com.planforge.common.constants.GenerationStatus;
import com.planforge.core.attempt.AttemptLedger;
import com.planforge.core.attempt.PlanNotFoundException;
import com.planforge.core.event.GenerationErrorMessages;
import com.planforge.data.entity.GenerationAttempt;
import com.planforge.data.entity.LearningPlan;
import com.planforge.data.repository.GenerationAttemptRepository;
import com.planforge.data.repository.LearningPlanRepository;
import com.planforge.data.repository.PlanModuleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of where a plan's generation stands, for polling clients.
 */
@Service
@RequiredArgsConstructor
public class PlanStatusService {

    private final LearningPlanRepository planRepository;
    private final GenerationAttemptRepository attemptRepository;
    private final PlanModuleRepository moduleRepository;
    private final AttemptLedger attemptLedger;

    @Transactional(readOnly = true)
    public PlanStatusView getStatus(UUID planId, UUID userId) {
        LearningPlan plan = planRepository.findByIdAndUserId(planId, userId)
            .orElseThrow(() -> new PlanNotFoundException(planId));

        long attempts = attemptRepository.countByPlanId(planId);
        int cap = attemptLedger.getAttemptCap();
        Optional<GenerationAttempt> latest = attemptRepository.findFirstByPlanIdOrderByAttemptNumberDesc(planId);
        FailureClassification latestClassification = latest.map(GenerationAttempt::getClassification).orElse(null);
        boolean running = latest.map(attempt -> attempt.getStatus() == AttemptStatus.IN_PROGRESS).orElse(false);

        PlanStatusView.Status status = derive(plan.getGenerationStatus(), running, moduleRepository.countByPlanId(planId) > 0);
        String latestError = status == PlanStatusView.Status.FAILED
            ? GenerationErrorMessages.messageFor(latestClassification)
            : null;

        return PlanStatusView.builder()
            .planId(planId)
            .status(status)
            .attempts(attempts)
            .attemptCap(cap)
            .latestClassification(latestClassification)
            .latestError(latestError)
            .retryable(!running && attempts < cap && plan.getGenerationStatus() != GenerationStatus.FAILED)
            .updatedAt(plan.getUpdatedAt())
            .build();
    }

    /**
     * A plan left {@code generating} with nothing running had a retryable failure. It reads as failed unless an
     * earlier attempt already produced a curriculum.
     */
    static PlanStatusView.Status derive(GenerationStatus generationStatus, boolean attemptRunning, boolean hasModules) {
        if (generationStatus == GenerationStatus.READY) {
            return PlanStatusView.Status.READY;
        }
        if (generationStatus == GenerationStatus.GENERATING) {
            if (attemptRunning) {
                return PlanStatusView.Status.PROCESSING;
            }
            return hasModules ? PlanStatusView.Status.READY : PlanStatusView.Status.FAILED;
        }
        if (generationStatus == GenerationStatus.FAILED) {
            return PlanStatusView.Status.FAILED;
        }
        return hasModules ? PlanStatusView.Status.READY : PlanStatusView.Status.PENDING;
    }
}
