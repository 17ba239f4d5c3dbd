package com.planforge.core.normalize;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NormalizedModule {
    String title;
    String description;
    int estimatedMinutes;
    List<NormalizedTask> tasks;
}
