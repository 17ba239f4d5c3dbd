package com.planforge.llm.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParsedTask {
    String title;
    String description;
    double estimatedMinutes;
}
