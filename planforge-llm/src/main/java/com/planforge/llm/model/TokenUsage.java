package com.planforge.llm.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class TokenUsage {
    Integer promptTokens;
    Integer completionTokens;
    Integer totalTokens;

    public Map<String, Object> toMap() {
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("prompt_tokens", promptTokens);
        usage.put("completion_tokens", completionTokens);
        usage.put("total_tokens", totalTokens);
        return usage;
    }
}
