package com.planforge.llm.provider;

import lombok.Getter;

/**
 * The backend throttled the request (HTTP 429 or an equivalent error body).
 */
@Getter
public class RateLimitException extends ProviderClient.ProviderException {

    private final Long retryAfterSeconds;

    public RateLimitException(String message, LlmProvider provider, Long retryAfterSeconds) {
        super(message, provider, 429, true);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitException(String message, LlmProvider provider, Long retryAfterSeconds, Throwable cause) {
        super(message, provider, 429, true, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
