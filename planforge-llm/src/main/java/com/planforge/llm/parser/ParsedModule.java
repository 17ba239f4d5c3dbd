package com.planforge.llm.parser;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ParsedModule {
    String title;
    String description;
    double estimatedMinutes;
    @Singular
    List<ParsedTask> tasks;
}
