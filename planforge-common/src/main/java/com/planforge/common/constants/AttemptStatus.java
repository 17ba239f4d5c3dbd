package com.planforge.common.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AttemptStatus {
    IN_PROGRESS("in_progress"),
    SUCCESS("success"),
    FAILURE("failure");

    @JsonValue
    private final String value;
}
