package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.TokenUsage;
import com.planforge.llm.prompt.PlanGenerationPrompts;
import com.planforge.llm.provider.InvalidResponseException;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.stream.StreamFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary backend. Uses {@code streamGenerateContent} with {@code alt=sse} and JSON response mode.
 */
@Component
@Slf4j
public class GeminiProviderClient extends AbstractStreamingProviderClient {

    private static final Set<String> BLOCKING_FINISH_REASONS = Set.of("SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT");

    public GeminiProviderClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${llm.gemini.api-key:${LLM_GEMINI_API_KEY:}}") String apiKey,
            @Value("${llm.gemini.model:}") String model) {
        super(LlmProvider.GEMINI, webClientBuilder, objectMapper, apiKey, model);
    }

    @Override
    protected Flux<StreamFragment> streamFragments(GenerationInput input, GenerationOptions options,
                                                   String model, String apiKey) {
        Map<String, Object> request = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", PlanGenerationPrompts.SYSTEM_PROMPT))
            ),
            "contents", List.of(
                Map.of("role", "user", "parts", List.of(
                    Map.of("text", PlanGenerationPrompts.buildUserPrompt(input))
                ))
            ),
            "generationConfig", Map.of(
                "maxOutputTokens", options.getMaxOutputTokens(),
                "temperature", options.getTemperature(),
                "responseMimeType", "application/json"
            )
        );

        String url = "/" + model + ":streamGenerateContent?alt=sse&key=" + apiKey;
        log.debug("[GEMINI] Sending request | requestId={} | model={}", options.getRequestId(), model);

        return webClient.post()
            .uri(url)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(request)
            .retrieve()
            .bodyToFlux(SSE_TYPE)
            .filter(event -> event.data() != null && !event.data().isBlank())
            .map(event -> toFragment(readEvent(event.data())));
    }

    private StreamFragment toFragment(JsonNode event) {
        failOnEmbeddedError(event);

        JsonNode candidate = event.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }

        String finishReason = candidate.path("finishReason").asText("");
        if (text.length() == 0 && BLOCKING_FINISH_REASONS.contains(finishReason)) {
            throw new InvalidResponseException("Gemini blocked the response: " + finishReason, LlmProvider.GEMINI);
        }
        JsonNode promptFeedback = event.path("promptFeedback").path("blockReason");
        if (!promptFeedback.isMissingNode()) {
            throw new InvalidResponseException("Gemini blocked the prompt: " + promptFeedback.asText(), LlmProvider.GEMINI);
        }

        TokenUsage usage = null;
        JsonNode usageNode = event.path("usageMetadata");
        if (!usageNode.isMissingNode() && !finishReason.isEmpty()) {
            usage = TokenUsage.builder()
                .promptTokens(usageNode.path("promptTokenCount").asInt())
                .completionTokens(usageNode.path("candidatesTokenCount").asInt())
                .totalTokens(usageNode.path("totalTokenCount").asInt())
                .build();
        }
        return new StreamFragment(text.toString(), usage);
    }
}
