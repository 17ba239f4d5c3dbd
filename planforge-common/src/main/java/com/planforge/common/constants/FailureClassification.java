package com.planforge.common.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of failure kinds persisted on an attempt and used to decide whether a plan may be retried.
 */
@Getter
@RequiredArgsConstructor
public enum FailureClassification {
    TIMEOUT("timeout", true),
    RATE_LIMIT("rate_limit", true),
    VALIDATION("validation", false),
    PROVIDER_ERROR("provider_error", true),
    CAPPED("capped", false);

    @JsonValue
    private final String value;

    /**
     * Whether a fresh attempt may plausibly succeed. A provider_error carrying a 4xx status is
     * still terminal; that refinement needs the error itself and lives in the classifier.
     */
    private final boolean retryable;
}
