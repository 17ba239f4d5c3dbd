package com.planforge.core.orchestrator;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.constants.FailureClassification;
import com.planforge.core.attempt.AttemptFailure;
import com.planforge.core.attempt.AttemptLedger;
import com.planforge.core.attempt.AttemptReservation;
import com.planforge.core.attempt.AttemptTiming;
import com.planforge.core.attempt.RejectionReason;
import com.planforge.core.attempt.ReservationResult;
import com.planforge.core.event.GenerationErrorMessages;
import com.planforge.core.event.GenerationEvent;
import com.planforge.core.event.GenerationEventChannel;
import com.planforge.core.input.GenerationRequest;
import com.planforge.core.input.InputSanitizer;
import com.planforge.core.input.SanitizedInput;
import com.planforge.core.orchestrator.AdaptiveTimeoutScheduler.AdaptiveTimeout;
import com.planforge.core.pacing.PlanPacer;
import com.planforge.data.entity.GenerationAttempt;
import com.planforge.llm.failure.FailureClassifier;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderMetadata;
import com.planforge.llm.model.ProviderResult;
import com.planforge.llm.parser.GenerationStreamParser;
import com.planforge.llm.parser.ParsedGeneration;
import com.planforge.llm.parser.ParsedModule;
import com.planforge.llm.router.ProviderRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Drives one user request through reserve, generate, parse and finalize.
 *
 * <p>The ledger transactions are the only synchronization between concurrent requests; this class keeps no
 * per-plan state. Every reserved attempt is finalized exactly once unless the finalize transaction itself
 * fails, in which case the error propagates after a terminal {@code error} event is published.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GenerationOrchestrator {

    private final InputSanitizer inputSanitizer;
    private final AttemptLedger attemptLedger;
    private final ProviderRouter providerRouter;
    private final GenerationStreamParser streamParser;
    private final PlanPacer planPacer;
    private final AdaptiveTimeoutScheduler timeoutScheduler;
    private final Clock clock;

    /**
     * Sanitizes the request and reserves an attempt. No backend is contacted.
     *
     * @throws IllegalArgumentException when the request is not usable
     * @throws com.planforge.core.attempt.PlanNotFoundException when the caller does not own the plan
     */
    public ReservationResult reserve(GenerationRequest request) {
        SanitizedInput sanitized = inputSanitizer.sanitize(request);
        return attemptLedger.reserve(request.getPlanId(), request.getUserId(), sanitized);
    }

    /**
     * Reserve and execute in one call. A rejection is published as a terminal {@code error} event.
     */
    public GenerationOutcome run(GenerationRequest request, GenerationEventChannel channel, CancellationToken token) {
        ReservationResult result = reserve(request);
        if (!result.isReserved()) {
            return reject(request, result, channel);
        }
        return execute(result.getReservation(), channel, token);
    }

    public GenerationOutcome execute(AttemptReservation reservation,
                                     GenerationEventChannel channel,
                                     CancellationToken token) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        GenerationInput input = reservation.getInput().getGenerationInput();

        channel.publish(GenerationEvent.planStart(reservation.getPlanId(), reservation.getAttemptId(),
            reservation.getAttemptNumber(), attemptLedger.getAttemptCap()));
        log.info("[ORCHESTRATOR] Attempt started | planId={} | attemptId={} | attemptNumber={}",
            reservation.getPlanId(), reservation.getAttemptId(), reservation.getAttemptNumber());

        AdaptiveTimeout timeout = timeoutScheduler.start(reservation.getPlanId(), token);
        GenerationOptions options = GenerationOptions.builder()
            .requestId(reservation.getAttemptId().toString())
            .cancellationToken(token)
            .build();

        ParsedGeneration parsed;
        ProviderMetadata providerMetadata;
        try (ProviderResult result = providerRouter.generate(input, options)) {
            parsed = streamParser.parse(result.getChunks(), () -> {
                timeout.onFirstModule();
                channel.publish(GenerationEvent.progress(reservation.getPlanId(), 0, null));
            }, token);
            providerMetadata = result.getMetadata();
        } catch (RuntimeException e) {
            timeout.stop();
            return fail(reservation, channel, token, timeout, e, startedAt, startNanos);
        }
        timeout.stop();

        List<ParsedModule> modules = planPacer.trimToCapacity(parsed.getModules(), input, LocalDate.now(clock));
        for (int i = 0; i < modules.size(); i++) {
            ParsedModule module = modules.get(i);
            channel.publish(GenerationEvent.moduleSummary(reservation.getPlanId(), i, module.getTitle(),
                module.getDescription(), Math.round(module.getEstimatedMinutes()), module.getTasks().size()));
            channel.publish(GenerationEvent.progress(reservation.getPlanId(), i + 1, modules.size()));
        }

        AttemptTiming timing = timing(startedAt, startNanos, timeout);
        GenerationAttempt attempt;
        try {
            attempt = attemptLedger.finalizeSuccess(reservation, modules, providerMetadata, timing);
        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Finalize failed, attempt left in progress | planId={} | attemptId={} | error={}",
                reservation.getPlanId(), reservation.getAttemptId(), e.getMessage(), e);
            channel.publish(GenerationEvent.error(reservation.getPlanId(), FailureClassification.PROVIDER_ERROR, false));
            throw e;
        }

        channel.publish(GenerationEvent.complete(reservation.getPlanId(), reservation.getAttemptId(),
            attempt.getModulesCount(), attempt.getTasksCount(), timing.getDurationMs()));
        log.info("[ORCHESTRATOR] Attempt succeeded | planId={} | attemptId={} | modules={} | tasks={} | durationMs={} | provider={}",
            reservation.getPlanId(), reservation.getAttemptId(), attempt.getModulesCount(), attempt.getTasksCount(),
            timing.getDurationMs(), providerMetadata != null ? providerMetadata.getProvider() : null);

        return GenerationOutcome.builder()
            .status(GenerationOutcome.Status.SUCCESS)
            .planId(reservation.getPlanId())
            .attemptId(reservation.getAttemptId())
            .attemptNumber(reservation.getAttemptNumber())
            .modulesCount(attempt.getModulesCount())
            .tasksCount(attempt.getTasksCount())
            .durationMs(timing.getDurationMs())
            .build();
    }

    private GenerationOutcome fail(AttemptReservation reservation,
                                   GenerationEventChannel channel,
                                   CancellationToken token,
                                   AdaptiveTimeout timeout,
                                   RuntimeException error,
                                   Instant startedAt,
                                   long startNanos) {
        CancellationReason reason = token.getReason();
        boolean timedOut = reason == CancellationReason.TIMEOUT || timeout.isTimedOut();
        boolean cancelled = reason == CancellationReason.CLIENT;
        // A client walking away is not a backend fault; record it as a provider error flagged cancelled
        FailureClassification classification = FailureClassifier.classify(error, timedOut,
            cancelled ? FailureClassification.PROVIDER_ERROR : null);

        AttemptTiming timing = timing(startedAt, startNanos, timeout);
        AttemptFailure failure = AttemptFailure.builder()
            .classification(classification)
            .timedOut(timedOut)
            .cancelled(cancelled)
            .error(error)
            .build();

        try {
            attemptLedger.finalizeFailure(reservation, failure, timing);
        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Finalize failed, attempt left in progress | planId={} | attemptId={} | error={}",
                reservation.getPlanId(), reservation.getAttemptId(), e.getMessage(), e);
            channel.publish(GenerationEvent.error(reservation.getPlanId(), classification, false));
            throw e;
        }

        GenerationOutcome.GenerationOutcomeBuilder outcome = GenerationOutcome.builder()
            .planId(reservation.getPlanId())
            .attemptId(reservation.getAttemptId())
            .attemptNumber(reservation.getAttemptNumber())
            .classification(classification)
            .durationMs(timing.getDurationMs());

        if (cancelled) {
            log.info("[ORCHESTRATOR] Attempt cancelled by client | planId={} | attemptId={} | durationMs={}",
                reservation.getPlanId(), reservation.getAttemptId(), timing.getDurationMs());
            channel.publish(GenerationEvent.cancelled(reservation.getPlanId(), "client"));
            return outcome.status(GenerationOutcome.Status.CANCELLED).retryable(false).build();
        }

        boolean retryable = !attemptLedger.isTerminal(classification, error, reservation.getAttemptNumber());
        log.warn("[ORCHESTRATOR] Attempt failed | planId={} | attemptId={} | classification={} | retryable={} | error={}",
            reservation.getPlanId(), reservation.getAttemptId(), classification.getValue(), retryable, error.getMessage());
        channel.publish(GenerationEvent.error(reservation.getPlanId(), classification, retryable));
        return outcome.status(GenerationOutcome.Status.FAILURE).retryable(retryable).build();
    }

    private GenerationOutcome reject(GenerationRequest request, ReservationResult result, GenerationEventChannel channel) {
        RejectionReason reason = result.getRejectionReason();
        if (reason == RejectionReason.CAPPED) {
            channel.publish(GenerationEvent.error(request.getPlanId(), FailureClassification.CAPPED, false));
        } else {
            channel.publish(GenerationEvent.error(request.getPlanId(), GenerationErrorMessages.IN_PROGRESS_CODE,
                GenerationErrorMessages.IN_PROGRESS_MESSAGE, null, true));
        }
        return GenerationOutcome.builder()
            .status(GenerationOutcome.Status.REJECTED)
            .planId(request.getPlanId())
            .rejectionReason(reason)
            .classification(reason == RejectionReason.CAPPED ? FailureClassification.CAPPED : null)
            .retryable(reason == RejectionReason.IN_PROGRESS)
            .build();
    }

    private AttemptTiming timing(Instant startedAt, long startNanos, AdaptiveTimeout timeout) {
        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        return AttemptTiming.builder()
            .startedAt(startedAt)
            .finishedAt(startedAt.plusMillis(durationMs))
            .durationMs(durationMs)
            .extendedTimeout(timeout.isExtended())
            .build();
    }
}
