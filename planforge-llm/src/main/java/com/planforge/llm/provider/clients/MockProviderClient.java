package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderMetadata;
import com.planforge.llm.model.ProviderResult;
import com.planforge.llm.model.TokenUsage;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.ProviderClient;
import com.planforge.llm.stream.ChunkStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Deterministic backend for local runs and tests. The curriculum is derived from the topic, skill level and
 * learning style, serialized to JSON and streamed in fixed-size slices.
 */
@Component
@Slf4j
public class MockProviderClient implements ProviderClient {

    static final int CHUNK_SIZE = 80;

    private static final TokenUsage MOCK_USAGE = TokenUsage.builder()
        .promptTokens(100)
        .completionTokens(500)
        .totalTokens(600)
        .build();

    private static final String[] STAGES = {
        "Foundations of", "Core Concepts in", "Working with", "Applied", "Advanced Topics in"
    };

    private static final String[] TASK_VERBS = {
        "Read an overview of", "Take notes on", "Complete exercises for", "Build a small example of", "Review and summarize"
    };

    private final ObjectMapper objectMapper;
    private final long chunkDelayMs;
    private final double failureRate;

    @Autowired
    public MockProviderClient(
            ObjectMapper objectMapper,
            @Value("${llm.mock.chunk-delay-ms:0}") long chunkDelayMs,
            @Value("${llm.mock.failure-rate:0.0}") double failureRate) {
        this.objectMapper = objectMapper;
        this.chunkDelayMs = chunkDelayMs;
        this.failureRate = failureRate;
    }

    public MockProviderClient(ObjectMapper objectMapper) {
        this(objectMapper, 0, 0.0);
    }

    @Override
    public ProviderResult generate(GenerationInput input, GenerationOptions options) throws ProviderException {
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            log.info("[MOCK] Simulating provider failure | requestId={} | failureRate={}", options.getRequestId(), failureRate);
            throw new ProviderException("Mock provider simulated failure", LlmProvider.MOCK, 503, true);
        }

        String payload = serialize(buildCurriculum(input));
        List<String> slices = slice(payload);
        log.info("[MOCK] Streaming mock curriculum | requestId={} | length={} | chunks={}",
            options.getRequestId(), payload.length(), slices.size());

        Flux<String> source = Flux.fromIterable(slices);
        if (chunkDelayMs > 0) {
            source = source.delayElements(Duration.ofMillis(chunkDelayMs));
        }

        ChunkStream stream = ChunkStream.open(source, options.getCancellationToken());
        return new ProviderResult(stream, () -> ProviderMetadata.builder()
            .provider("mock")
            .model(getModel())
            .usage(MOCK_USAGE)
            .build());
    }

    Map<String, Object> buildCurriculum(GenerationInput input) {
        int seed = (input.getTopic() + "|" + input.getSkillLevel() + "|" + input.getLearningStyle()).hashCode() & Integer.MAX_VALUE;
        int moduleCount = 3 + seed % 3;
        String topic = input.getTopic();

        List<Map<String, Object>> modules = new ArrayList<>();
        for (int m = 0; m < moduleCount; m++) {
            int taskCount = 3 + (seed / (m + 1)) % 3;
            List<Map<String, Object>> tasks = new ArrayList<>();
            int taskTotal = 0;
            for (int t = 0; t < taskCount; t++) {
                int minutes = 30 + Math.floorMod(seed / (m + 1) + t * 17, 61);
                taskTotal += minutes;
                Map<String, Object> task = new LinkedHashMap<>();
                task.put("title", TASK_VERBS[t % TASK_VERBS.length] + " " + topic + " (part " + (m + 1) + "." + (t + 1) + ")");
                task.put("description", describeTask(input.getLearningStyle(), input.getSkillLevel()));
                task.put("estimated_minutes", minutes);
                tasks.add(task);
            }
            int moduleMinutes = Math.max(taskTotal, 120 + Math.floorMod(seed + m * 31, 121));

            Map<String, Object> module = new LinkedHashMap<>();
            module.put("title", "Module " + (m + 1) + ": " + STAGES[Math.min(m, STAGES.length - 1)] + " " + topic);
            module.put("description", "Build " + input.getSkillLevel().getValue() + "-level understanding of " + topic + ".");
            module.put("estimated_minutes", moduleMinutes);
            module.put("tasks", tasks);
            modules.add(module);
        }
        return Map.of("modules", modules);
    }

    private String describeTask(LearningStyle style, SkillLevel level) {
        return "Focus on " + style.getPromptHint() + ", pitched at " + level.getValue() + " level.";
    }

    private String serialize(Map<String, Object> curriculum) {
        try {
            return objectMapper.writeValueAsString(curriculum);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Mock provider could not serialize curriculum", LlmProvider.MOCK,
                ProviderException.NO_STATUS, false, e);
        }
    }

    private List<String> slice(String payload) {
        List<String> slices = new ArrayList<>();
        for (int i = 0; i < payload.length(); i += CHUNK_SIZE) {
            slices.add(payload.substring(i, Math.min(payload.length(), i + CHUNK_SIZE)));
        }
        return slices;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.MOCK;
    }

    @Override
    public String getModel() {
        return LlmProvider.MOCK.getDefaultModel();
    }

    @Override
    public boolean isConfigured() {
        return true;
    }
}
