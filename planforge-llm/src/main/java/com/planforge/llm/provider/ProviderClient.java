package com.planforge.llm.provider;

import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderResult;

/**
 * A generation backend. {@link #generate} returns once the backend has accepted the request and the first
 * chunk (or the end of an empty stream) is available; HTTP-level rejections surface here, while failures
 * after that point surface while the chunk stream is consumed.
 */
public interface ProviderClient {

    ProviderResult generate(GenerationInput input, GenerationOptions options) throws ProviderException;

    LlmProvider getProvider();

    String getModel();

    /** Whether credentials are present; unconfigured clients are left out of the routing chain. */
    boolean isConfigured();

    class ProviderException extends RuntimeException {
        /** No HTTP status was observed (connection reset, DNS failure, malformed frame). */
        public static final int NO_STATUS = 0;

        private final boolean retryable;
        private final int statusCode;
        private final LlmProvider provider;

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable) {
            super(message);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public boolean isRetryable() { return retryable; }
        public int getStatusCode() { return statusCode; }
        public boolean hasStatusCode() { return statusCode != NO_STATUS; }
        public LlmProvider getProvider() { return provider; }
        public boolean isRateLimited() { return statusCode == 429; }
    }
}
