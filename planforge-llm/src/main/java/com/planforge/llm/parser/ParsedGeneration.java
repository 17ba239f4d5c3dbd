package com.planforge.llm.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated curriculum extracted from one backend stream. Transient; normalized before it is persisted.
 */
@Value
@Builder
public class ParsedGeneration {
    List<ParsedModule> modules;
    int rawLength;

    public int getTaskCount() {
        return modules.stream().mapToInt(module -> module.getTasks().size()).sum();
    }
}
