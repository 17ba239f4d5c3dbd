package com.planforge.llm.failure;

import com.planforge.common.concurrent.GenerationCancelledException;
import com.planforge.common.constants.FailureClassification;
import com.planforge.llm.parser.ParserException;
import com.planforge.llm.provider.InvalidResponseException;
import com.planforge.llm.provider.ProviderClient.ProviderException;
import com.planforge.llm.provider.ProviderTimeoutException;
import com.planforge.llm.provider.RateLimitException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps any failure raised during an attempt onto {@link FailureClassification}. Pure and total: every input,
 * including null, yields a classification, and the same input always yields the same one.
 *
 * <p>Precedence: forced classification, then the timed-out flag, then typed errors, then
 * {@link FailureClassification#PROVIDER_ERROR} for everything else (including invalid JSON).</p>
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    public static FailureClassification classify(Throwable error) {
        return classify(error, false, null);
    }

    public static FailureClassification classify(Throwable error, boolean timedOut, FailureClassification forced) {
        if (forced != null) {
            return forced;
        }
        if (timedOut) {
            return FailureClassification.TIMEOUT;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof RateLimitException) {
            return FailureClassification.RATE_LIMIT;
        }
        if (cause instanceof ProviderTimeoutException) {
            return FailureClassification.TIMEOUT;
        }
        if (cause instanceof GenerationCancelledException cancelled && cancelled.isTimeout()) {
            return FailureClassification.TIMEOUT;
        }
        if (cause instanceof InvalidResponseException) {
            return FailureClassification.VALIDATION;
        }
        if (cause instanceof ProviderException providerError && providerError.isRateLimited()) {
            return FailureClassification.RATE_LIMIT;
        }
        if (cause instanceof ParserException parserError
                && parserError.getKind() == ParserException.Kind.VALIDATION) {
            return FailureClassification.VALIDATION;
        }
        return FailureClassification.PROVIDER_ERROR;
    }

    public static boolean isRetryableClassification(FailureClassification classification) {
        return classification != null && classification.isRetryable();
    }

    /**
     * Whether the router should retry the same backend: throttling and 5xx responses only.
     * Validation, timeout, 4xx and cancellation move on (or stop) immediately.
     */
    public static boolean isRouterRetryable(Throwable error) {
        FailureClassification classification = classify(error);
        if (classification == FailureClassification.RATE_LIMIT) {
            return true;
        }
        if (classification == FailureClassification.PROVIDER_ERROR) {
            Integer status = statusCodeOf(error);
            return status != null && status >= 500;
        }
        return false;
    }

    /**
     * A provider_error is retryable by a fresh attempt unless the backend answered with a 4xx.
     * Errors with no status at all (network, malformed output) count as retryable.
     */
    public static boolean isProviderErrorRetryable(Throwable error) {
        Integer status = statusCodeOf(error);
        if (status == null || status >= 500) {
            return true;
        }
        return status < 400;
    }

    public static Integer statusCodeOf(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ProviderException providerError && providerError.hasStatusCode()) {
            return providerError.getStatusCode();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
