package com.planforge.core.attempt;

import com.planforge.common.constants.FailureClassification;
import com.planforge.llm.model.ProviderMetadata;
import lombok.Builder;
import lombok.Value;

/**
 * What went wrong with an attempt, as recorded by {@link AttemptLedger#finalizeFailure}.
 */
@Value
@Builder
public class AttemptFailure {
    FailureClassification classification;
    boolean timedOut;
    /** Abandoned by the caller rather than failed by the backend. */
    boolean cancelled;
    Throwable error;
    /** Backend that was streaming when the failure happened, if any got that far. */
    ProviderMetadata providerMetadata;
}
