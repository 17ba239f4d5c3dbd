package com.planforge.core.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.constants.FailureClassification;
import com.planforge.core.attempt.AttemptFailure;
import com.planforge.core.attempt.AttemptLedger;
import com.planforge.core.attempt.AttemptReservation;
import com.planforge.core.attempt.RejectionReason;
import com.planforge.core.attempt.ReservationResult;
import com.planforge.core.event.GenerationEvent;
import com.planforge.core.event.GenerationEventChannel;
import com.planforge.core.event.GenerationEventType;
import com.planforge.core.input.GenerationRequest;
import com.planforge.core.input.InputSanitizer;
import com.planforge.core.pacing.PlanPacer;
import com.planforge.data.entity.GenerationAttempt;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderMetadata;
import com.planforge.llm.model.ProviderResult;
import com.planforge.llm.parser.GenerationStreamParser;
import com.planforge.llm.parser.ParsedModule;
import com.planforge.llm.parser.ParserException;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.ProviderClient;
import com.planforge.llm.provider.RateLimitException;
import com.planforge.llm.router.ProviderRouter;
import com.planforge.llm.stream.ChunkStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GenerationOrchestratorTest {

    private static final String ONE_MODULE = """
        {"modules":[{"title":"Basics","estimated_minutes":60,"tasks":[{"title":"Read intro","estimated_minutes":30}]}]}
        """;

    private final UUID planId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final InputSanitizer sanitizer = new InputSanitizer();
    private final GenerationStreamParser parser = new GenerationStreamParser(new ObjectMapper());

    private AttemptLedger ledger;
    private ProviderRouter router;
    private AdaptiveTimeoutScheduler timeouts;
    private GenerationEventChannel channel;

    @BeforeEach
    void setUp() {
        ledger = mock(AttemptLedger.class);
        router = mock(ProviderRouter.class);
        when(ledger.getAttemptCap()).thenReturn(3);
        when(ledger.finalizeSuccess(any(), anyList(), any(), any())).thenAnswer(invocation -> {
            List<ParsedModule> modules = invocation.getArgument(1);
            return GenerationAttempt.builder()
                .modulesCount(modules.size())
                .tasksCount(modules.stream().mapToInt(module -> module.getTasks().size()).sum())
                .build();
        });
        timeouts = new AdaptiveTimeoutScheduler(5_000, 1_000, 2_000);
        channel = new GenerationEventChannel();
    }

    @AfterEach
    void tearDown() {
        timeouts.shutdown();
    }

    @Test
    @SuppressWarnings("unchecked")
    void validSingleChunkIsPersistedAsSuccess() throws Exception {
        when(router.generate(any(), any())).thenReturn(result("gemini", ONE_MODULE));

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, CancellationToken.create());

        assertThat(outcome.getStatus()).isEqualTo(GenerationOutcome.Status.SUCCESS);
        assertThat(outcome.getModulesCount()).isEqualTo(1);
        assertThat(outcome.getTasksCount()).isEqualTo(1);

        ArgumentCaptor<List<ParsedModule>> modules = ArgumentCaptor.forClass(List.class);
        verify(ledger).finalizeSuccess(any(), modules.capture(), any(), any());
        assertThat(modules.getValue()).singleElement().extracting(ParsedModule::getTitle).isEqualTo("Basics");
        verify(ledger, never()).finalizeFailure(any(), any(), any());

        List<GenerationEvent> events = drain();
        assertThat(events.get(0).getType()).isEqualTo(GenerationEventType.PLAN_START);
        assertThat(events).filteredOn(event -> event.getType() == GenerationEventType.MODULE_SUMMARY)
            .singleElement()
            .satisfies(event -> assertThat(event.getData())
                .containsEntry("index", 0)
                .containsEntry("title", "Basics")
                .containsEntry("taskCount", 1));
        assertThat(events).filteredOn(event -> event.getType() == GenerationEventType.PROGRESS)
            .last()
            .satisfies(event -> assertThat(event.getData()).containsEntry("modulesParsed", 1).containsEntry("totalModules", 1));
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(GenerationEventType.COMPLETE);
    }

    @Test
    void emptyModuleListIsAValidationFailure() throws Exception {
        when(router.generate(any(), any())).thenReturn(result("gemini", "{\"modules\": []}"));
        when(ledger.isTerminal(eq(FailureClassification.VALIDATION), any(), anyInt())).thenReturn(true);

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, CancellationToken.create());

        assertThat(outcome.getStatus()).isEqualTo(GenerationOutcome.Status.FAILURE);
        assertThat(outcome.getClassification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(outcome.isRetryable()).isFalse();

        AttemptFailure failure = capturedFailure();
        assertThat(failure.getClassification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(failure.getError()).hasMessageContaining("zero modules");
        verify(ledger, never()).finalizeSuccess(any(), anyList(), any(), any());

        GenerationEvent last = lastEvent();
        assertThat(last.getType()).isEqualTo(GenerationEventType.ERROR);
        assertThat(last.getData())
            .containsEntry("classification", "validation")
            .containsEntry("retryable", false)
            .containsEntry("message", "Invalid response from AI. Please try again.");
    }

    @Test
    void rateLimitedPrimaryFallsBackAndOnlySecondBackendIsRecorded() {
        ProviderClient primary = client(LlmProvider.GEMINI);
        ProviderClient secondary = client(LlmProvider.GROQ);
        when(primary.generate(any(), any()))
            .thenThrow(new RateLimitException("quota", LlmProvider.GEMINI, null))
            .thenThrow(new RateLimitException("quota", LlmProvider.GEMINI, null));
        when(secondary.generate(any(), any())).thenReturn(result("groq", ONE_MODULE));
        router = new ProviderRouter(List.of(primary, secondary), 1, 0, 0);

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, CancellationToken.create());

        assertThat(outcome.isSuccess()).isTrue();
        verify(primary, times(2)).generate(any(), any());
        verify(secondary, times(1)).generate(any(), any());
        ArgumentCaptor<ProviderMetadata> metadata = ArgumentCaptor.forClass(ProviderMetadata.class);
        verify(ledger).finalizeSuccess(any(), anyList(), metadata.capture(), any());
        assertThat(metadata.getValue().getProvider()).isEqualTo("groq");
        assertThat(metadata.getValue().getRouterAttempts()).isEqualTo(3);
    }

    @Test
    void cappedPlanIsRejectedWithoutCallingAnyBackend() throws Exception {
        when(ledger.reserve(eq(planId), eq(userId), any()))
            .thenReturn(ReservationResult.rejected(RejectionReason.CAPPED, 3, 3));

        GenerationOutcome outcome = orchestrator().run(request(), channel, CancellationToken.create());

        assertThat(outcome.getStatus()).isEqualTo(GenerationOutcome.Status.REJECTED);
        assertThat(outcome.getRejectionReason()).isEqualTo(RejectionReason.CAPPED);
        assertThat(outcome.isRetryable()).isFalse();
        verifyNoInteractions(router);
        assertThat(lastEvent().getData())
            .containsEntry("code", "attempt_cap_reached")
            .containsEntry("classification", "capped");
    }

    @Test
    void inProgressRejectionIsReportedAsAConflict() throws Exception {
        when(ledger.reserve(eq(planId), eq(userId), any()))
            .thenReturn(ReservationResult.rejected(RejectionReason.IN_PROGRESS, 1, 3));

        GenerationOutcome outcome = orchestrator().run(request(), channel, CancellationToken.create());

        assertThat(outcome.getRejectionReason()).isEqualTo(RejectionReason.IN_PROGRESS);
        verifyNoInteractions(router);
        assertThat(lastEvent().getData()).containsEntry("code", "generation_in_progress");
    }

    @Test
    void nonNumericModuleEffortFailsValidationNamingTheModule() {
        String json = """
            {"modules":[{"title":"Vague","estimated_minutes":"a while","tasks":[{"title":"t","estimated_minutes":5}]}]}
            """;
        when(router.generate(any(), any())).thenReturn(result("gemini", json));

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, CancellationToken.create());

        assertThat(outcome.getClassification()).isEqualTo(FailureClassification.VALIDATION);
        assertThat(capturedFailure().getError())
            .isInstanceOf(ParserException.class)
            .hasMessage("Module 1 estimated minutes must be a finite number.");
    }

    @Test
    void clientCancellationMidStreamFinalizesWithoutModules() throws Exception {
        when(router.generate(any(), any())).thenAnswer(invocation -> {
            GenerationOptions options = invocation.getArgument(1);
            Flux<String> stalled = Flux.concat(Flux.just("{\"modules\":[{\"title\":\"Half"), Flux.never());
            return new ProviderResult(ChunkStream.open(stalled, options.getCancellationToken()),
                () -> ProviderMetadata.builder().provider("gemini").build());
        });
        CancellationToken token = CancellationToken.create();
        CompletableFuture.runAsync(() -> token.cancel(CancellationReason.CLIENT),
            CompletableFuture.delayedExecutor(150, TimeUnit.MILLISECONDS));

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, token);

        assertThat(outcome.getStatus()).isEqualTo(GenerationOutcome.Status.CANCELLED);
        assertThat(outcome.isRetryable()).isFalse();
        AttemptFailure failure = capturedFailure();
        assertThat(failure.isCancelled()).isTrue();
        assertThat(failure.getClassification()).isEqualTo(FailureClassification.PROVIDER_ERROR);
        verify(ledger, never()).finalizeSuccess(any(), anyList(), any(), any());
        assertThat(lastEvent().getType()).isEqualTo(GenerationEventType.CANCELLED);
    }

    @Test
    void stalledBackendTimesOut() throws Exception {
        timeouts.shutdown();
        timeouts = new AdaptiveTimeoutScheduler(100, 50, 10);
        when(router.generate(any(), any())).thenAnswer(invocation -> {
            GenerationOptions options = invocation.getArgument(1);
            return new ProviderResult(ChunkStream.open(Flux.never(), options.getCancellationToken()),
                () -> ProviderMetadata.builder().provider("gemini").build());
        });
        when(ledger.isTerminal(eq(FailureClassification.TIMEOUT), any(), anyInt())).thenReturn(false);

        GenerationOutcome outcome = orchestrator().execute(reservation(), channel, CancellationToken.create());

        assertThat(outcome.getStatus()).isEqualTo(GenerationOutcome.Status.FAILURE);
        assertThat(outcome.getClassification()).isEqualTo(FailureClassification.TIMEOUT);
        assertThat(outcome.isRetryable()).isTrue();
        assertThat(capturedFailure().isTimedOut()).isTrue();
        assertThat(lastEvent().getData()).containsEntry("code", "generation_timeout");
    }

    @Test
    void deadlineTrimsCurriculumBeforePersisting() {
        String json = """
            {"modules":[
              {"title":"A","estimated_minutes":120,"tasks":[{"title":"a1","estimated_minutes":30},{"title":"a2","estimated_minutes":30},{"title":"a3","estimated_minutes":30}]},
              {"title":"B","estimated_minutes":120,"tasks":[{"title":"b1","estimated_minutes":30},{"title":"b2","estimated_minutes":30}]}]}
            """;
        when(router.generate(any(), any())).thenReturn(result("gemini", json));
        // 1 hour a week for one week at 55 minutes per beginner task: room for a single task
        GenerationRequest tight = request().toBuilder()
            .weeklyHours(1)
            .startDate(clock.instant().atZone(ZoneOffset.UTC).toLocalDate())
            .deadlineDate(clock.instant().atZone(ZoneOffset.UTC).toLocalDate().plusDays(3))
            .build();

        GenerationOutcome outcome = orchestrator().execute(reservation(tight), channel, CancellationToken.create());

        assertThat(outcome.getModulesCount()).isEqualTo(2);
        assertThat(outcome.getTasksCount()).isEqualTo(2);
    }

    private GenerationOrchestrator orchestrator() {
        return new GenerationOrchestrator(sanitizer, ledger, router, parser, new PlanPacer(), timeouts, clock);
    }

    private GenerationRequest request() {
        return GenerationRequest.builder()
            .planId(planId)
            .userId(userId)
            .topic("Rust")
            .weeklyHours(5)
            .build();
    }

    private AttemptReservation reservation() {
        return reservation(request());
    }

    private AttemptReservation reservation(GenerationRequest request) {
        return AttemptReservation.builder()
            .attemptId(UUID.randomUUID())
            .attemptNumber(1)
            .planId(planId)
            .userId(userId)
            .input(sanitizer.sanitize(request))
            .promptHash("hash")
            .startedAt(clock.instant())
            .build();
    }

    private AttemptFailure capturedFailure() {
        ArgumentCaptor<AttemptFailure> failure = ArgumentCaptor.forClass(AttemptFailure.class);
        verify(ledger).finalizeFailure(any(), failure.capture(), any());
        return failure.getValue();
    }

    private List<GenerationEvent> drain() throws InterruptedException {
        List<GenerationEvent> events = new ArrayList<>();
        GenerationEvent event;
        while ((event = channel.poll(0, TimeUnit.MILLISECONDS)) != null) {
            events.add(event);
        }
        return events;
    }

    private GenerationEvent lastEvent() throws InterruptedException {
        List<GenerationEvent> events = drain();
        assertThat(events).isNotEmpty();
        return events.get(events.size() - 1);
    }

    private static ProviderClient client(LlmProvider provider) {
        ProviderClient client = mock(ProviderClient.class);
        when(client.getProvider()).thenReturn(provider);
        when(client.getModel()).thenReturn(provider.getDefaultModel());
        when(client.isConfigured()).thenReturn(true);
        return client;
    }

    private static ProviderResult result(String provider, String json) {
        return new ProviderResult(ChunkStream.of(json),
            () -> ProviderMetadata.builder().provider(provider).model("test-model").build());
    }
}
