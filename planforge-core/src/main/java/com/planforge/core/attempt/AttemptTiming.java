package com.planforge.core.attempt;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AttemptTiming {
    Instant startedAt;
    Instant finishedAt;
    long durationMs;
    boolean extendedTimeout;
}
