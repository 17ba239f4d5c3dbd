package com.planforge.core.event;

import com.planforge.common.constants.FailureClassification;

/**
 * User-facing code and message per failure classification. Raw provider errors never reach the client.
 */
public final class GenerationErrorMessages {

    public static final String IN_PROGRESS_CODE = "generation_in_progress";
    public static final String IN_PROGRESS_MESSAGE = "A generation is already running for this plan. Please wait for it to finish.";

    private GenerationErrorMessages() {}

    public static String codeFor(FailureClassification classification) {
        if (classification == null) {
            return "generation_failed";
        }
        return switch (classification) {
            case TIMEOUT -> "generation_timeout";
            case RATE_LIMIT -> "rate_limited";
            case VALIDATION -> "invalid_response";
            case CAPPED -> "attempt_cap_reached";
            case PROVIDER_ERROR -> "generation_failed";
        };
    }

    public static String messageFor(FailureClassification classification) {
        if (classification == null) {
            return "An unexpected error occurred. Please try again.";
        }
        return switch (classification) {
            case TIMEOUT -> "Generation timed out. Please try again.";
            case RATE_LIMIT -> "Rate limit exceeded. Please wait and try again.";
            case VALIDATION -> "Invalid response from AI. Please try again.";
            case CAPPED -> "Maximum generation attempts reached for this plan.";
            case PROVIDER_ERROR -> "An unexpected error occurred. Please try again.";
        };
    }
}
