package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.llm.provider.LlmProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class GroqProviderClient extends OpenAiCompatibleProviderClient {

    public GroqProviderClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${llm.groq.api-key:${LLM_GROQ_API_KEY:}}") String apiKey,
            @Value("${llm.groq.model:}") String model) {
        super(LlmProvider.GROQ, webClientBuilder, objectMapper, apiKey, model);
    }
}
