package com.planforge.llm.provider.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderMetadata;
import com.planforge.llm.model.ProviderResult;
import com.planforge.llm.model.TokenUsage;
import com.planforge.llm.provider.InvalidResponseException;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.ProviderClient;
import com.planforge.llm.provider.ProviderTimeoutException;
import com.planforge.llm.provider.RateLimitException;
import com.planforge.llm.stream.ChunkStream;
import com.planforge.llm.stream.StreamFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared plumbing for backends that stream their answer as server-sent events: error mapping, first-chunk
 * timeout, usage capture and the blocking {@link ChunkStream} hand-off.
 */
@Slf4j
public abstract class AbstractStreamingProviderClient implements ProviderClient {

    protected static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    private final LlmProvider provider;
    private final String apiKey;
    private final String model;

    protected AbstractStreamingProviderClient(LlmProvider provider, WebClient.Builder webClientBuilder,
                                              ObjectMapper objectMapper, String apiKey, String model) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model != null && !model.isBlank() ? model : provider.getDefaultModel();
        this.webClient = webClientBuilder.clone()
            .baseUrl(provider.getBaseUrl())
            .defaultHeader("Content-Type", "application/json")
            .build();
    }

    /**
     * Opens the backend's event stream. Implementations decode each event into a fragment and leave error
     * mapping to the caller.
     */
    protected abstract Flux<StreamFragment> streamFragments(GenerationInput input, GenerationOptions options,
                                                            String model, String apiKey);

    @Override
    public ProviderResult generate(GenerationInput input, GenerationOptions options) throws ProviderException {
        if (!isConfigured()) {
            throw new ProviderException(provider.getDisplayName() + " API key not configured", provider, 401, false);
        }
        long startTime = System.currentTimeMillis();
        log.info("[{}] Starting streamed generation | requestId={} | model={} | topicLength={}",
            provider.name(), options.getRequestId(), model, input.getTopic().length());

        AtomicReference<TokenUsage> usage = new AtomicReference<>();
        Flux<String> chunks = streamFragments(input, options, model, apiKey)
            .doOnNext(fragment -> {
                if (fragment.usage() != null) {
                    usage.set(fragment.usage());
                }
            })
            .map(StreamFragment::text)
            .filter(text -> !text.isEmpty())
            .timeout(Mono.delay(options.getFirstChunkTimeout()), chunk -> Mono.never())
            .onErrorMap(error -> !(error instanceof ProviderException), this::mapException);

        ChunkStream stream = ChunkStream.open(chunks, options.getCancellationToken());
        try {
            // Surface HTTP rejections (429, 5xx, auth) from generate() so the router can retry them
            stream.hasNext();
        } catch (RuntimeException e) {
            stream.close();
            log.warn("[{}] Stream failed before first chunk | requestId={} | model={} | durationMs={} | error={}",
                provider.name(), options.getRequestId(), model, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }

        log.info("[{}] Stream opened | requestId={} | model={} | firstChunkMs={}",
            provider.name(), options.getRequestId(), model, System.currentTimeMillis() - startTime);

        return new ProviderResult(stream, () -> ProviderMetadata.builder()
            .provider(provider.name().toLowerCase())
            .model(model)
            .usage(usage.get())
            .build());
    }

    protected JsonNode readEvent(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException(provider.getDisplayName() + " sent a malformed stream event", provider, e);
        }
    }

    /**
     * Error objects embedded in a 200 stream (some gateways report throttling this way).
     */
    protected void failOnEmbeddedError(JsonNode event) {
        JsonNode error = event.path("error");
        if (error.isMissingNode() || error.isNull()) {
            return;
        }
        int code = error.path("code").asInt(ProviderException.NO_STATUS);
        String message = error.path("message").asText(provider.getDisplayName() + " stream error");
        if (code == 429) {
            throw new RateLimitException(message, provider, null);
        }
        throw new ProviderException(message, provider, code, code == ProviderException.NO_STATUS || code >= 500);
    }

    protected ProviderException mapException(Throwable error) {
        if (error instanceof WebClientResponseException e) {
            return mapResponseException(e);
        }
        if (error instanceof TimeoutException) {
            return new ProviderTimeoutException(
                provider.getDisplayName() + " did not start streaming in time", provider, error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderException(
                provider.getDisplayName() + " request failed: " + error.getMessage(),
                provider, ProviderException.NO_STATUS, true, error);
        }
        return new ProviderException(
            provider.getDisplayName() + " stream failed: " + error.getMessage(),
            provider, ProviderException.NO_STATUS, true, error);
    }

    private ProviderException mapResponseException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        // 429 and 5xx are transient; other 4xx mean the request itself is wrong
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText());

        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            if (body.has("error") && body.get("error").has("message")) {
                message = body.get("error").get("message").asText();
            }
        } catch (JsonProcessingException parseError) {
            log.debug("[{}] Error body is not JSON | statusCode={}", provider.name(), status);
        }

        log.warn("[{}] HTTP error | statusCode={} | retryable={} | message={}", provider.name(), status, retryable, message);

        if (status == 429) {
            return new RateLimitException(message, provider, parseRetryAfter(e), e);
        }
        return new ProviderException(message, provider, status, retryable, e);
    }

    private Long parseRetryAfter(WebClientResponseException e) {
        String retryAfter = e.getHeaders().getFirst("Retry-After");
        if (retryAfter == null) {
            return null;
        }
        try {
            return Long.parseLong(retryAfter.trim());
        } catch (NumberFormatException ex) {
            log.debug("[{}] Ignoring non-numeric Retry-After | value={}", provider.name(), retryAfter);
            return null;
        }
    }

    @Override
    public LlmProvider getProvider() {
        return provider;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
