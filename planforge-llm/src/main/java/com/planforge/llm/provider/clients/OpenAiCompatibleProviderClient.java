package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.TokenUsage;
import com.planforge.llm.prompt.PlanGenerationPrompts;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.stream.StreamFragment;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Chat-completions style backends ({@code stream: true}, {@code data: [DONE]} terminator).
 */
public abstract class OpenAiCompatibleProviderClient extends AbstractStreamingProviderClient {

    private static final String DONE_MARKER = "[DONE]";

    protected OpenAiCompatibleProviderClient(LlmProvider provider, WebClient.Builder webClientBuilder,
                                             ObjectMapper objectMapper, String apiKey, String model) {
        super(provider, webClientBuilder, objectMapper, apiKey, model);
    }

    /** Extra headers some gateways require (attribution, routing). */
    protected WebClient.RequestBodySpec customizeRequest(WebClient.RequestBodySpec request) {
        return request;
    }

    @Override
    protected Flux<StreamFragment> streamFragments(GenerationInput input, GenerationOptions options,
                                                   String model, String apiKey) {
        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", PlanGenerationPrompts.SYSTEM_PROMPT),
                Map.of("role", "user", "content", PlanGenerationPrompts.buildUserPrompt(input))
            ),
            "stream", true,
            "max_tokens", options.getMaxOutputTokens(),
            "temperature", options.getTemperature(),
            "response_format", Map.of("type", "json_object")
        );

        WebClient.RequestBodySpec spec = webClient.post()
            .header("Authorization", "Bearer " + apiKey)
            .accept(MediaType.TEXT_EVENT_STREAM);

        return customizeRequest(spec)
            .bodyValue(request)
            .retrieve()
            .bodyToFlux(SSE_TYPE)
            .map(event -> event.data() == null ? "" : event.data().trim())
            .takeWhile(data -> !DONE_MARKER.equals(data))
            .filter(data -> !data.isEmpty())
            .map(data -> toFragment(readEvent(data)));
    }

    private StreamFragment toFragment(JsonNode event) {
        failOnEmbeddedError(event);

        String text = event.path("choices").path(0).path("delta").path("content").asText("");

        JsonNode usageNode = event.path("usage");
        if (usageNode.isMissingNode() || usageNode.isNull()) {
            usageNode = event.path("x_groq").path("usage");
        }
        TokenUsage usage = null;
        if (!usageNode.isMissingNode() && !usageNode.isNull()) {
            usage = TokenUsage.builder()
                .promptTokens(usageNode.path("prompt_tokens").asInt())
                .completionTokens(usageNode.path("completion_tokens").asInt())
                .totalTokens(usageNode.path("total_tokens").asInt())
                .build();
        }
        return new StreamFragment(text, usage);
    }
}
