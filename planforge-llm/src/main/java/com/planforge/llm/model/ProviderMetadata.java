package com.planforge.llm.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity of the backend that produced a result, persisted in the attempt metadata under {@code provider}.
 */
@Value
@Builder(toBuilder = true)
public class ProviderMetadata {
    String provider;
    String model;
    TokenUsage usage;
    int routerAttempts;

    public Map<String, Object> toMap() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider);
        metadata.put("model", model);
        metadata.put("usage", usage != null ? usage.toMap() : null);
        metadata.put("router_attempts", routerAttempts);
        return metadata;
    }
}
