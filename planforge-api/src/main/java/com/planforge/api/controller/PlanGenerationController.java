package com.planforge.api.controller;

import com.planforge.api.dto.request.GeneratePlanRequest;
import com.planforge.api.exception.GenerationCapacityException;
import com.planforge.api.exception.GenerationRejectedException;
import com.planforge.api.stream.GenerationStreamExecutor;
import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.constants.FailureClassification;
import com.planforge.core.attempt.AttemptReservation;
import com.planforge.core.attempt.ReservationResult;
import com.planforge.core.event.GenerationEvent;
import com.planforge.core.event.GenerationEventChannel;
import com.planforge.core.orchestrator.GenerationOrchestrator;
import com.planforge.core.ratelimit.GenerationRateLimiter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Starts a generation and streams its events as SSE.
 *
 * <p>Reservation happens on the request thread so rejections come back as plain JSON with a proper status
 * code (see {@link GenerationRejectedException}). A stream slot is taken first, so a busy server answers 503
 * without consuming an attempt. Once reserved, one worker runs the attempt and another relays channel events
 * to the emitter.</p>
 */
@RestController
@RequestMapping("/api/v1/plans")
@Slf4j
public class PlanGenerationController {

    private static final long POLL_INTERVAL_MS = 500;
    private static final long CAPACITY_RETRY_AFTER_SECONDS = 5;

    private final GenerationOrchestrator orchestrator;
    private final GenerationRateLimiter rateLimiter;
    private final GenerationStreamExecutor streams;
    private final long sseTimeoutMs;

    public PlanGenerationController(
            GenerationOrchestrator orchestrator,
            GenerationRateLimiter rateLimiter,
            GenerationStreamExecutor streams,
            @Value("${planforge.sse.timeout-ms:120000}") long sseTimeoutMs
    ) {
        this.orchestrator = orchestrator;
        this.rateLimiter = rateLimiter;
        this.streams = streams;
        this.sseTimeoutMs = sseTimeoutMs;
    }

    @PostMapping("/{planId}/generation")
    public ResponseEntity<SseEmitter> generate(
            @PathVariable UUID planId,
            @Valid @RequestBody GeneratePlanRequest request,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        rateLimiter.checkAndConsume(userId);

        if (!streams.tryAcquire()) {
            log.warn("[GENERATION_API] Stream capacity exhausted | planId={} | activeStreams={}",
                planId, streams.activeStreams());
            throw new GenerationCapacityException(streams.getMaxStreams(), CAPACITY_RETRY_AFTER_SECONDS);
        }

        AttemptReservation reservation;
        try {
            ReservationResult result = orchestrator.reserve(request.toGenerationRequest(planId, userId));
            if (!result.isReserved()) {
                log.info("[GENERATION_API] Generation rejected | planId={} | reason={} | attemptsUsed={} | cap={}",
                    planId, result.getRejectionReason().getValue(), result.getAttemptsUsed(), result.getAttemptCap());
                throw new GenerationRejectedException(planId, result);
            }
            reservation = result.getReservation();
        } catch (RuntimeException e) {
            streams.release();
            throw e;
        }

        GenerationEventChannel channel = new GenerationEventChannel();
        CancellationToken token = CancellationToken.create();
        SseEmitter emitter = new SseEmitter(sseTimeoutMs);

        emitter.onCompletion(() -> token.cancel(CancellationReason.CLIENT));
        emitter.onTimeout(() -> {
            log.warn("[GENERATION_API] SSE timeout | planId={} | attemptId={}", planId, reservation.getAttemptId());
            token.cancel(CancellationReason.CLIENT);
            emitter.complete();
        });
        emitter.onError(e -> {
            log.warn("[GENERATION_API] SSE error | planId={} | attemptId={} | error={}",
                planId, reservation.getAttemptId(), e.getMessage());
            token.cancel(CancellationReason.CLIENT);
        });

        streams.start(
            () -> runAttempt(reservation, channel, token),
            () -> relay(reservation, channel, token, emitter));

        log.info("[GENERATION_API] Streaming started | planId={} | attemptId={} | userId={}",
            planId, reservation.getAttemptId(), userId);
        return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(emitter);
    }

    private void runAttempt(AttemptReservation reservation, GenerationEventChannel channel, CancellationToken token) {
        try {
            orchestrator.execute(reservation, channel, token);
        } catch (RuntimeException e) {
            log.error("[GENERATION_API] Attempt execution failed | planId={} | attemptId={} | error={}",
                reservation.getPlanId(), reservation.getAttemptId(), e.getMessage(), e);
        } finally {
            if (!channel.isTerminated()) {
                channel.publish(GenerationEvent.error(reservation.getPlanId(), FailureClassification.PROVIDER_ERROR, false));
            }
        }
    }

    private void relay(AttemptReservation reservation,
                       GenerationEventChannel channel,
                       CancellationToken token,
                       SseEmitter emitter) {
        boolean connected = true;
        try {
            while (true) {
                GenerationEvent event = channel.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (connected) {
                    connected = send(emitter, event, reservation, token);
                }
                if (event.isTerminal()) {
                    break;
                }
            }
            if (connected) {
                emitter.complete();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel(CancellationReason.CLIENT);
            emitter.completeWithError(e);
        }
    }

    /**
     * @return false once the client is gone; later events are drained without sending
     */
    private boolean send(SseEmitter emitter, GenerationEvent event, AttemptReservation reservation, CancellationToken token) {
        try {
            emitter.send(SseEmitter.event()
                .name(event.getType().getValue())
                .data(event.getData(), MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.info("[GENERATION_API] Client disconnected | planId={} | attemptId={} | event={} | error={}",
                reservation.getPlanId(), reservation.getAttemptId(), event.getType().getValue(), e.getMessage());
            token.cancel(CancellationReason.CLIENT);
            return false;
        }
    }
}
