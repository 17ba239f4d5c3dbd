package com.planforge.llm.failure;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.GenerationCancelledException;
import com.planforge.common.constants.FailureClassification;
import com.planforge.llm.parser.ParserException;
import com.planforge.llm.provider.InvalidResponseException;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.ProviderClient.ProviderException;
import com.planforge.llm.provider.ProviderTimeoutException;
import com.planforge.llm.provider.RateLimitException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    private static final RateLimitException RATE_LIMITED = new RateLimitException("slow down", LlmProvider.GEMINI, 5L);

    @Nested
    class Classify {

        @Test
        void forcedClassificationWinsOverEverything() {
            assertThat(FailureClassifier.classify(RATE_LIMITED, true, FailureClassification.CAPPED))
                .isEqualTo(FailureClassification.CAPPED);
        }

        @Test
        void timedOutFlagWinsOverTypedErrors() {
            assertThat(FailureClassifier.classify(RATE_LIMITED, true, null)).isEqualTo(FailureClassification.TIMEOUT);
        }

        @Test
        void rateLimitErrorIsAlwaysRateLimit() {
            assertThat(FailureClassifier.classify(RATE_LIMITED)).isEqualTo(FailureClassification.RATE_LIMIT);
            assertThat(FailureClassifier.classify(RATE_LIMITED)).isEqualTo(FailureClassifier.classify(RATE_LIMITED));
        }

        @Test
        void untyped429IsRateLimit() {
            ProviderException error = new ProviderException("429", LlmProvider.GROQ, 429, true);
            assertThat(FailureClassifier.classify(error)).isEqualTo(FailureClassification.RATE_LIMIT);
        }

        @Test
        void providerTimeoutIsTimeout() {
            ProviderTimeoutException error = new ProviderTimeoutException("slow", LlmProvider.GROQ, new TimeoutException());
            assertThat(FailureClassifier.classify(error)).isEqualTo(FailureClassification.TIMEOUT);
        }

        @Test
        void deadlineCancellationIsTimeoutButClientCancellationIsNot() {
            assertThat(FailureClassifier.classify(new GenerationCancelledException(CancellationReason.TIMEOUT)))
                .isEqualTo(FailureClassification.TIMEOUT);
            assertThat(FailureClassifier.classify(new GenerationCancelledException(CancellationReason.CLIENT)))
                .isEqualTo(FailureClassification.PROVIDER_ERROR);
        }

        @Test
        void invalidResponseAndParserValidationAreValidation() {
            assertThat(FailureClassifier.classify(new InvalidResponseException("blocked", LlmProvider.GEMINI)))
                .isEqualTo(FailureClassification.VALIDATION);
            assertThat(FailureClassifier.classify(ParserException.validation("Module 1 is not an object.")))
                .isEqualTo(FailureClassification.VALIDATION);
        }

        @Test
        void invalidJsonIsProviderError() {
            ParserException error = new ParserException(ParserException.Kind.INVALID_JSON, "bad json");
            assertThat(FailureClassifier.classify(error)).isEqualTo(FailureClassification.PROVIDER_ERROR);
        }

        @Test
        void unknownAndNullErrorsAreProviderError() {
            assertThat(FailureClassifier.classify(new IllegalStateException("boom"))).isEqualTo(FailureClassification.PROVIDER_ERROR);
            assertThat(FailureClassifier.classify(null)).isEqualTo(FailureClassification.PROVIDER_ERROR);
        }

        @Test
        void unwrapsCompletionException() {
            assertThat(FailureClassifier.classify(new CompletionException(RATE_LIMITED)))
                .isEqualTo(FailureClassification.RATE_LIMIT);
        }
    }

    @Nested
    class Retryability {

        @Test
        void classificationRetryability() {
            assertThat(FailureClassifier.isRetryableClassification(FailureClassification.TIMEOUT)).isTrue();
            assertThat(FailureClassifier.isRetryableClassification(FailureClassification.RATE_LIMIT)).isTrue();
            assertThat(FailureClassifier.isRetryableClassification(FailureClassification.PROVIDER_ERROR)).isTrue();
            assertThat(FailureClassifier.isRetryableClassification(FailureClassification.VALIDATION)).isFalse();
            assertThat(FailureClassifier.isRetryableClassification(FailureClassification.CAPPED)).isFalse();
        }

        @Test
        void routerRetriesRateLimitsAndServerErrorsOnly() {
            assertThat(FailureClassifier.isRouterRetryable(RATE_LIMITED)).isTrue();
            assertThat(FailureClassifier.isRouterRetryable(new ProviderException("down", LlmProvider.GROQ, 503, true))).isTrue();
            assertThat(FailureClassifier.isRouterRetryable(new ProviderException("bad", LlmProvider.GROQ, 400, false))).isFalse();
            assertThat(FailureClassifier.isRouterRetryable(new ProviderTimeoutException("slow", LlmProvider.GROQ, null))).isFalse();
            assertThat(FailureClassifier.isRouterRetryable(ParserException.validation("nope"))).isFalse();
            assertThat(FailureClassifier.isRouterRetryable(new GenerationCancelledException(CancellationReason.CLIENT))).isFalse();
        }

        @Test
        void providerErrorWithClientStatusIsTerminal() {
            assertThat(FailureClassifier.isProviderErrorRetryable(new ProviderException("auth", LlmProvider.GROQ, 401, false))).isFalse();
            assertThat(FailureClassifier.isProviderErrorRetryable(new ProviderException("down", LlmProvider.GROQ, 502, true))).isTrue();
            assertThat(FailureClassifier.isProviderErrorRetryable(new IllegalStateException("no status"))).isTrue();
        }
    }
}
