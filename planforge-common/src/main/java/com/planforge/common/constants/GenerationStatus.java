package com.planforge.common.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a plan's curriculum generation. Only the attempt ledger moves a plan between these states.
 */
@Getter
@RequiredArgsConstructor
public enum GenerationStatus {
    NOT_STARTED("not_started"),
    GENERATING("generating"),
    READY("ready"),
    FAILED("failed");

    @JsonValue
    private final String value;
}
