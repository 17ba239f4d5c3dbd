package com.planforge.core.status;

import com.planforge.common.constants.AttemptStatus;
import com.planforge.common.constants.FailureClassification;
import com.planforge.common.constants.GenerationStatus;
import com.planforge.core.attempt.AttemptLedger;
import com.planforge.core.attempt.PlanNotFoundException;
import com.planforge.data.entity.GenerationAttempt;
import com.planforge.data.entity.LearningPlan;
import com.planforge.data.repository.GenerationAttemptRepository;
import com.planforge.data.repository.LearningPlanRepository;
import com.planforge.data.repository.PlanModuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlanStatusServiceTest {

    private final UUID planId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    private LearningPlanRepository planRepository;
    private GenerationAttemptRepository attemptRepository;
    private PlanModuleRepository moduleRepository;
    private PlanStatusService service;

    @BeforeEach
    void setUp() {
        planRepository = mock(LearningPlanRepository.class);
        attemptRepository = mock(GenerationAttemptRepository.class);
        moduleRepository = mock(PlanModuleRepository.class);
        AttemptLedger ledger = mock(AttemptLedger.class);
        when(ledger.getAttemptCap()).thenReturn(3);
        service = new PlanStatusService(planRepository, attemptRepository, moduleRepository, ledger);
    }

    @Test
    void derivationCoversEveryPlanState() {
        assertThat(PlanStatusService.derive(GenerationStatus.NOT_STARTED, false, false)).isEqualTo(PlanStatusView.Status.PENDING);
        assertThat(PlanStatusService.derive(GenerationStatus.GENERATING, true, false)).isEqualTo(PlanStatusView.Status.PROCESSING);
        assertThat(PlanStatusService.derive(GenerationStatus.GENERATING, false, false)).isEqualTo(PlanStatusView.Status.FAILED);
        assertThat(PlanStatusService.derive(GenerationStatus.GENERATING, false, true)).isEqualTo(PlanStatusView.Status.READY);
        assertThat(PlanStatusService.derive(GenerationStatus.READY, false, true)).isEqualTo(PlanStatusView.Status.READY);
        assertThat(PlanStatusService.derive(GenerationStatus.FAILED, false, false)).isEqualTo(PlanStatusView.Status.FAILED);
    }

    @Test
    void failedPlanReportsAUserFacingMessage() {
        plan(GenerationStatus.FAILED);
        latestAttempt(AttemptStatus.FAILURE, FailureClassification.VALIDATION);
        when(attemptRepository.countByPlanId(planId)).thenReturn(1L);

        PlanStatusView view = service.getStatus(planId, userId);

        assertThat(view.getStatus()).isEqualTo(PlanStatusView.Status.FAILED);
        assertThat(view.getLatestClassification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(view.getLatestError()).isEqualTo("Invalid response from AI. Please try again.");
        assertThat(view.isRetryable()).isFalse();
    }

    @Test
    void runningAttemptReadsAsProcessing() {
        plan(GenerationStatus.GENERATING);
        latestAttempt(AttemptStatus.IN_PROGRESS, null);
        when(attemptRepository.countByPlanId(planId)).thenReturn(2L);

        PlanStatusView view = service.getStatus(planId, userId);

        assertThat(view.getStatus()).isEqualTo(PlanStatusView.Status.PROCESSING);
        assertThat(view.getAttempts()).isEqualTo(2);
        assertThat(view.getAttemptCap()).isEqualTo(3);
        assertThat(view.getLatestError()).isNull();
        assertThat(view.isRetryable()).isFalse();
    }

    @Test
    void retryableFailureLeavesRoomForAnotherAttempt() {
        plan(GenerationStatus.GENERATING);
        latestAttempt(AttemptStatus.FAILURE, FailureClassification.TIMEOUT);
        when(attemptRepository.countByPlanId(planId)).thenReturn(1L);

        PlanStatusView view = service.getStatus(planId, userId);

        assertThat(view.getStatus()).isEqualTo(PlanStatusView.Status.FAILED);
        assertThat(view.getLatestError()).isEqualTo("Generation timed out. Please try again.");
        assertThat(view.isRetryable()).isTrue();
    }

    @Test
    void unknownOrForeignPlanIsNotFound() {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus(planId, userId)).isInstanceOf(PlanNotFoundException.class);
    }

    private void plan(GenerationStatus status) {
        when(planRepository.findByIdAndUserId(planId, userId)).thenReturn(Optional.of(LearningPlan.builder()
            .id(planId)
            .userId(userId)
            .topic("Go")
            .generationStatus(status)
            .build()));
    }

    private void latestAttempt(AttemptStatus status, FailureClassification classification) {
        when(attemptRepository.findFirstByPlanIdOrderByAttemptNumberDesc(planId)).thenReturn(Optional.of(
            GenerationAttempt.builder().attemptNumber(1).status(status).classification(classification).build()));
    }
}
