package com.planforge.core.input;

import com.planforge.common.util.TruncatedText;
import com.planforge.llm.model.GenerationInput;
import lombok.Builder;
import lombok.Value;

/**
 * Bounded generation input plus a record of what had to be cut to get there.
 */
@Value
@Builder
public class SanitizedInput {
    GenerationInput generationInput;
    TruncatedText topic;
    TruncatedText notes;
    TruncatedText sourceContext;
    /** SHA-256 of the full, untruncated source context; null when none was supplied. */
    String sourceContextDigest;
}
