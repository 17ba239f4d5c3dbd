package com.planforge.core.event;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GenerationEventType {
    PLAN_START("plan_start", false),
    MODULE_SUMMARY("module_summary", false),
    PROGRESS("progress", false),
    COMPLETE("complete", true),
    ERROR("error", true),
    CANCELLED("cancelled", true);

    /** SSE event name. */
    @JsonValue
    private final String value;

    private final boolean terminal;
}
