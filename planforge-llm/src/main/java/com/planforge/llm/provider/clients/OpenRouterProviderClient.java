package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.llm.provider.LlmProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Overflow backend, only placed in the chain when {@code llm.router.enable-overflow} is set.
 */
@Component
public class OpenRouterProviderClient extends OpenAiCompatibleProviderClient {

    private final String referer;
    private final String appTitle;

    public OpenRouterProviderClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${llm.openrouter.api-key:${LLM_OPENROUTER_API_KEY:}}") String apiKey,
            @Value("${llm.openrouter.model:}") String model,
            @Value("${llm.openrouter.referer:http://localhost:3000}") String referer,
            @Value("${llm.openrouter.app-title:PlanForge}") String appTitle) {
        super(LlmProvider.OPENROUTER, webClientBuilder, objectMapper, apiKey, model);
        this.referer = referer;
        this.appTitle = appTitle;
    }

    @Override
    protected WebClient.RequestBodySpec customizeRequest(WebClient.RequestBodySpec request) {
        return request
            .header("HTTP-Referer", referer)
            .header("X-Title", appTitle);
    }
}
