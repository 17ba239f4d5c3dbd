package com.planforge.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Generation backends, in default fallback order.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    GEMINI(
        "Gemini",
        1,       // primary
        "https://generativelanguage.googleapis.com/v1beta/models",
        "gemini-1.5-flash"
    ),

    GROQ(
        "Groq",
        2,       // fallback
        "https://api.groq.com/openai/v1/chat/completions",
        "llama-3.1-8b-instant"
    ),

    OPENROUTER(
        "OpenRouter",
        3,       // overflow, only when enabled
        "https://openrouter.ai/api/v1/chat/completions",
        "meta-llama/llama-3.1-8b-instruct"
    ),

    MOCK(
        "Mock",
        99,
        "",
        "mock-generator-v1"
    );

    private final String displayName;
    private final int priority;
    private final String baseUrl;
    private final String defaultModel;

    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
