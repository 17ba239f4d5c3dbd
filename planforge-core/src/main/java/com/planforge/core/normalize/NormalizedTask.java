package com.planforge.core.normalize;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NormalizedTask {
    String title;
    String description;
    int estimatedMinutes;
}
