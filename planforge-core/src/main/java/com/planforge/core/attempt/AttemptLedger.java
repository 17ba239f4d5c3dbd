package com.planforge.core.attempt;

import com.planforge.common.constants.AttemptStatus;
import com.planforge.common.constants.FailureClassification;
import com.planforge.common.constants.GenerationStatus;
import com.planforge.core.input.InputSanitizer;
import com.planforge.core.input.SanitizedInput;
import com.planforge.core.normalize.EffortNormalizer;
import com.planforge.core.normalize.NormalizedCurriculum;
import com.planforge.core.normalize.NormalizedModule;
import com.planforge.core.normalize.NormalizedTask;
import com.planforge.data.entity.GenerationAttempt;
import com.planforge.data.entity.LearningPlan;
import com.planforge.data.entity.PlanModule;
import com.planforge.data.entity.PlanTask;
import com.planforge.data.repository.GenerationAttemptRepository;
import com.planforge.data.repository.LearningPlanRepository;
import com.planforge.data.repository.PlanModuleRepository;
import com.planforge.data.repository.PlanTaskRepository;
import com.planforge.llm.failure.FailureClassifier;
import com.planforge.llm.model.ProviderMetadata;
import com.planforge.llm.parser.ParsedModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Owns every write to a plan's generation state. Each public method is one transaction that starts by locking
 * the plan row, so reservations and finalizations for the same plan are strictly serialized. The lock is only
 * held for the duration of these short transactions, never while a backend is streaming.
 *
 * <p>Persistence errors are not caught here: they roll the transaction back and propagate. An attempt whose
 * finalization failed therefore stays {@code in_progress} and needs investigation.</p>
 */
@Service
@Slf4j
public class AttemptLedger {

    public static final int DEFAULT_ATTEMPT_CAP = 3;

    private final LearningPlanRepository planRepository;
    private final GenerationAttemptRepository attemptRepository;
    private final PlanModuleRepository moduleRepository;
    private final PlanTaskRepository taskRepository;
    private final InputSanitizer inputSanitizer;
    private final EffortNormalizer effortNormalizer;
    private final Clock clock;
    private final int attemptCap;

    public AttemptLedger(
            LearningPlanRepository planRepository,
            GenerationAttemptRepository attemptRepository,
            PlanModuleRepository moduleRepository,
            PlanTaskRepository taskRepository,
            InputSanitizer inputSanitizer,
            EffortNormalizer effortNormalizer,
            Clock clock,
            @Value("${planforge.attempts.cap:${ATTEMPT_CAP:3}}") int attemptCap) {
        if (attemptCap < 1) {
            throw new IllegalArgumentException("Attempt cap must be at least 1, got " + attemptCap);
        }
        this.planRepository = planRepository;
        this.attemptRepository = attemptRepository;
        this.moduleRepository = moduleRepository;
        this.taskRepository = taskRepository;
        this.inputSanitizer = inputSanitizer;
        this.effortNormalizer = effortNormalizer;
        this.clock = clock;
        this.attemptCap = attemptCap;
    }

    /**
     * Reserves the next attempt for a plan, or explains why none can be started.
     *
     * @throws PlanNotFoundException when the plan does not exist or is owned by someone else
     */
    @Transactional(rollbackFor = Exception.class)
    public ReservationResult reserve(UUID planId, UUID userId, SanitizedInput input) {
        LearningPlan plan = lockOwnedPlan(planId, userId);

        // The cap counts every attempt regardless of status
        long existing = attemptRepository.countByPlanId(planId);
        if (existing >= attemptCap) {
            log.warn("[LEDGER] Reservation rejected | planId={} | reason=capped | attempts={} | cap={}",
                planId, existing, attemptCap);
            return ReservationResult.rejected(RejectionReason.CAPPED, existing, attemptCap);
        }
        if (attemptRepository.existsByPlanIdAndStatus(planId, AttemptStatus.IN_PROGRESS)) {
            log.warn("[LEDGER] Reservation rejected | planId={} | reason=in_progress | attempts={}", planId, existing);
            return ReservationResult.rejected(RejectionReason.IN_PROGRESS, existing, attemptCap);
        }

        int attemptNumber = (int) existing + 1;
        String promptHash = inputSanitizer.promptHash(planId, userId, input);

        GenerationAttempt attempt = GenerationAttempt.builder()
            .plan(plan)
            .attemptNumber(attemptNumber)
            .status(AttemptStatus.IN_PROGRESS)
            .truncatedTopic(input.getTopic().truncated())
            .truncatedNotes(input.getNotes().truncated())
            .promptHash(promptHash)
            .build();
        attempt = attemptRepository.saveAndFlush(attempt);

        plan.setGenerationStatus(GenerationStatus.GENERATING);
        planRepository.save(plan);

        log.info("[LEDGER] Attempt reserved | planId={} | attemptId={} | attemptNumber={}/{}",
            planId, attempt.getId(), attemptNumber, attemptCap);

        return ReservationResult.reserved(AttemptReservation.builder()
            .attemptId(attempt.getId())
            .attemptNumber(attemptNumber)
            .planId(planId)
            .userId(userId)
            .input(input)
            .promptHash(promptHash)
            .startedAt(clock.instant())
            .build(), attemptCap);
    }

    /**
     * Replaces the plan's modules and tasks with the generated curriculum and marks the attempt successful.
     * All or nothing: a failure at any step leaves no trace of this attempt's modules.
     */
    @Transactional(rollbackFor = Exception.class)
    public GenerationAttempt finalizeSuccess(AttemptReservation reservation,
                                             List<ParsedModule> modules,
                                             ProviderMetadata providerMetadata,
                                             AttemptTiming timing) {
        LearningPlan plan = lockPlan(reservation.getPlanId());
        GenerationAttempt attempt = loadInProgress(reservation);
        NormalizedCurriculum curriculum = effortNormalizer.normalize(modules);

        int deletedTasks = taskRepository.deleteByPlanId(plan.getId());
        int deletedModules = moduleRepository.deleteByPlanId(plan.getId());
        log.debug("[LEDGER] Cleared previous curriculum | planId={} | modules={} | tasks={}",
            plan.getId(), deletedModules, deletedTasks);

        List<PlanModule> moduleRows = new ArrayList<>(curriculum.getModuleCount());
        for (int i = 0; i < curriculum.getModules().size(); i++) {
            NormalizedModule module = curriculum.getModules().get(i);
            moduleRows.add(PlanModule.builder()
                .plan(plan)
                .position(i + 1)
                .title(module.getTitle())
                .description(module.getDescription())
                .estimatedMinutes(module.getEstimatedMinutes())
                .build());
        }
        moduleRows = moduleRepository.saveAll(moduleRows);
        moduleRepository.flush();

        List<PlanTask> taskRows = new ArrayList<>(curriculum.getTaskCount());
        for (int i = 0; i < curriculum.getModules().size(); i++) {
            PlanModule moduleRow = moduleRows.get(i);
            List<NormalizedTask> tasks = curriculum.getModules().get(i).getTasks();
            for (int j = 0; j < tasks.size(); j++) {
                NormalizedTask task = tasks.get(j);
                taskRows.add(PlanTask.builder()
                    .module(moduleRow)
                    .plan(plan)
                    .position(j + 1)
                    .title(task.getTitle())
                    .description(task.getDescription())
                    .estimatedMinutes(task.getEstimatedMinutes())
                    .build());
            }
        }
        taskRepository.saveAll(taskRows);
        taskRepository.flush();

        Instant now = clock.instant();
        attempt.setStatus(AttemptStatus.SUCCESS);
        attempt.setClassification(null);
        attempt.setDurationMs(timing.getDurationMs());
        attempt.setModulesCount(curriculum.getModuleCount());
        attempt.setTasksCount(curriculum.getTaskCount());
        attempt.setNormalizedEffort(curriculum.isClamped());
        attempt.setMetadata(AttemptMetadataBuilder.success(reservation.getInput(), curriculum, providerMetadata, timing));
        attempt.setCompletedAt(now);
        attemptRepository.save(attempt);

        plan.setGenerationStatus(GenerationStatus.READY);
        plan.setQuotaEligible(true);
        plan.setFinalizedAt(now);
        planRepository.save(plan);

        log.info("[LEDGER] Attempt finalized | planId={} | attemptId={} | status=success | durationMs={} | modules={} | tasks={} | provider={}",
            plan.getId(), attempt.getId(), timing.getDurationMs(), curriculum.getModuleCount(),
            curriculum.getTaskCount(), providerMetadata != null ? providerMetadata.getProvider() : null);
        return attempt;
    }

    /**
     * Records a failed attempt. The plan becomes {@code failed} only when the failure is terminal; otherwise it
     * stays {@code generating} so the next reservation can retry.
     */
    @Transactional(rollbackFor = Exception.class)
    public GenerationAttempt finalizeFailure(AttemptReservation reservation,
                                             AttemptFailure failure,
                                             AttemptTiming timing) {
        LearningPlan plan = lockPlan(reservation.getPlanId());
        GenerationAttempt attempt = loadInProgress(reservation);

        Instant now = clock.instant();
        attempt.setStatus(AttemptStatus.FAILURE);
        attempt.setClassification(failure.getClassification());
        attempt.setDurationMs(timing.getDurationMs());
        attempt.setModulesCount(0);
        attempt.setTasksCount(0);
        attempt.setMetadata(AttemptMetadataBuilder.failure(reservation.getInput(), failure, timing));
        attempt.setCompletedAt(now);
        attemptRepository.save(attempt);

        boolean terminal = isTerminal(failure.getClassification(), failure.getError(), reservation.getAttemptNumber());
        if (terminal) {
            plan.setGenerationStatus(GenerationStatus.FAILED);
            plan.setQuotaEligible(false);
            plan.setFinalizedAt(now);
            planRepository.save(plan);
        }

        log.info("[LEDGER] Attempt finalized | planId={} | attemptId={} | status=failure | classification={} | timedOut={} | cancelled={} | terminal={} | durationMs={}",
            plan.getId(), attempt.getId(), failure.getClassification().getValue(), failure.isTimedOut(),
            failure.isCancelled(), terminal, timing.getDurationMs());
        return attempt;
    }

    /**
     * A failure is terminal when its classification is not retryable, when it is a provider error the backend
     * answered with a 4xx, or when the attempt used the last slot of the cap.
     */
    public boolean isTerminal(FailureClassification classification, Throwable error, int attemptNumber) {
        if (attemptNumber >= attemptCap) {
            return true;
        }
        if (!FailureClassifier.isRetryableClassification(classification)) {
            return true;
        }
        return classification == FailureClassification.PROVIDER_ERROR && !FailureClassifier.isProviderErrorRetryable(error);
    }

    public int getAttemptCap() {
        return attemptCap;
    }

    private LearningPlan lockOwnedPlan(UUID planId, UUID userId) {
        LearningPlan plan = lockPlan(planId);
        if (!plan.getUserId().equals(userId)) {
            log.warn("[LEDGER] Reservation refused for non-owner | planId={} | userId={}", planId, userId);
            throw new PlanNotFoundException(planId);
        }
        return plan;
    }

    private LearningPlan lockPlan(UUID planId) {
        return planRepository.findByIdForUpdate(planId)
            .orElseThrow(() -> new PlanNotFoundException(planId));
    }

    private GenerationAttempt loadInProgress(AttemptReservation reservation) {
        GenerationAttempt attempt = attemptRepository.findById(reservation.getAttemptId())
            .orElseThrow(() -> new IllegalStateException("Reserved attempt not found: " + reservation.getAttemptId()));
        if (attempt.getStatus() != AttemptStatus.IN_PROGRESS) {
            throw new IllegalStateException("Attempt " + reservation.getAttemptId() + " is already finalized as "
                + attempt.getStatus().getValue());
        }
        return attempt;
    }
}
