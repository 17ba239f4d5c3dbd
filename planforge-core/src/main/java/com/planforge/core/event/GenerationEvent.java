package com.planforge.core.event;

import com.planforge.common.constants.FailureClassification;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One typed event on the generation stream. {@code data} is serialized as the SSE payload.
 */
@Value
public class GenerationEvent {
    GenerationEventType type;
    Map<String, Object> data;

    private GenerationEvent(GenerationEventType type, Map<String, Object> data) {
        this.type = type;
        this.data = Collections.unmodifiableMap(data);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    public static GenerationEvent planStart(UUID planId, UUID attemptId, int attemptNumber, int attemptCap) {
        Map<String, Object> data = payload(planId);
        data.put("attemptId", attemptId.toString());
        data.put("attemptNumber", attemptNumber);
        data.put("attemptCap", attemptCap);
        return new GenerationEvent(GenerationEventType.PLAN_START, data);
    }

    public static GenerationEvent moduleSummary(UUID planId, int index, String title, String description,
                                                long estimatedMinutes, int taskCount) {
        Map<String, Object> data = payload(planId);
        data.put("index", index);
        data.put("title", title);
        data.put("description", description);
        data.put("estimatedMinutes", estimatedMinutes);
        data.put("taskCount", taskCount);
        return new GenerationEvent(GenerationEventType.MODULE_SUMMARY, data);
    }

    /**
     * @param totalModules total expected, or null while still unknown
     */
    public static GenerationEvent progress(UUID planId, int modulesParsed, Integer totalModules) {
        Map<String, Object> data = payload(planId);
        data.put("modulesParsed", modulesParsed);
        data.put("totalModules", totalModules);
        return new GenerationEvent(GenerationEventType.PROGRESS, data);
    }

    public static GenerationEvent complete(UUID planId, UUID attemptId, int modulesCount, int tasksCount, long durationMs) {
        Map<String, Object> data = payload(planId);
        data.put("attemptId", attemptId.toString());
        data.put("modulesCount", modulesCount);
        data.put("tasksCount", tasksCount);
        data.put("durationMs", durationMs);
        return new GenerationEvent(GenerationEventType.COMPLETE, data);
    }

    public static GenerationEvent error(UUID planId, FailureClassification classification, boolean retryable) {
        return error(planId, GenerationErrorMessages.codeFor(classification),
            GenerationErrorMessages.messageFor(classification), classification, retryable);
    }

    public static GenerationEvent error(UUID planId, String code, String message,
                                        FailureClassification classification, boolean retryable) {
        Map<String, Object> data = payload(planId);
        data.put("code", code);
        data.put("message", message);
        data.put("classification", classification != null ? classification.getValue() : null);
        data.put("retryable", retryable);
        return new GenerationEvent(GenerationEventType.ERROR, data);
    }

    public static GenerationEvent cancelled(UUID planId, String reason) {
        Map<String, Object> data = payload(planId);
        data.put("reason", reason);
        return new GenerationEvent(GenerationEventType.CANCELLED, data);
    }

    private static Map<String, Object> payload(UUID planId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planId", planId.toString());
        return data;
    }
}
