package com.planforge.core.attempt;

import com.planforge.common.util.TruncatedText;
import com.planforge.core.input.SanitizedInput;
import com.planforge.core.normalize.NormalizedCurriculum;
import com.planforge.llm.model.ProviderMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the audit blob stored in {@code generation_attempts.metadata}.
 */
final class AttemptMetadataBuilder {

    static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private AttemptMetadataBuilder() {}

    static Map<String, Object> success(SanitizedInput input,
                                       NormalizedCurriculum curriculum,
                                       ProviderMetadata provider,
                                       AttemptTiming timing) {
        Map<String, Object> metadata = base(input, timing);
        Map<String, Object> normalization = new LinkedHashMap<>();
        normalization.put("modules_clamped", curriculum.isModulesClamped());
        normalization.put("tasks_clamped", curriculum.isTasksClamped());
        metadata.put("normalization", normalization);
        metadata.put("provider", provider != null ? provider.toMap() : null);
        return metadata;
    }

    static Map<String, Object> failure(SanitizedInput input, AttemptFailure failure, AttemptTiming timing) {
        Map<String, Object> metadata = base(input, timing);
        metadata.put("provider", failure.getProviderMetadata() != null ? failure.getProviderMetadata().toMap() : null);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("classification", failure.getClassification().getValue());
        detail.put("timed_out", failure.isTimedOut());
        detail.put("cancelled", failure.isCancelled());
        detail.put("message", errorMessage(failure.getError()));
        metadata.put("failure", detail);
        return metadata;
    }

    private static Map<String, Object> base(SanitizedInput input, AttemptTiming timing) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        Map<String, Object> inputSection = new LinkedHashMap<>();
        inputSection.put("topic", truncation(input.getTopic()));
        inputSection.put("notes", truncation(input.getNotes()));
        inputSection.put("source_context", truncation(input.getSourceContext()));
        metadata.put("input", inputSection);

        if (input.getSourceContextDigest() != null) {
            metadata.put("source", Map.of("context_digest", input.getSourceContextDigest()));
        }

        Map<String, Object> timingSection = new LinkedHashMap<>();
        timingSection.put("started_at", timing.getStartedAt().toString());
        timingSection.put("finished_at", timing.getFinishedAt().toString());
        timingSection.put("duration_ms", timing.getDurationMs());
        timingSection.put("extended_timeout", timing.isExtendedTimeout());
        metadata.put("timing", timingSection);
        return metadata;
    }

    private static Map<String, Object> truncation(TruncatedText text) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("truncated", text.truncated());
        section.put("original_length", text.originalLength());
        return section;
    }

    private static String errorMessage(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
