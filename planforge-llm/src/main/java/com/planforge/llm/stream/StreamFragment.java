package com.planforge.llm.stream;

import com.planforge.llm.model.TokenUsage;

/**
 * One decoded server-sent event: a slice of generated text and, on the final event, token usage.
 */
public record StreamFragment(String text, TokenUsage usage) {

    public static StreamFragment text(String text) {
        return new StreamFragment(text, null);
    }
}
