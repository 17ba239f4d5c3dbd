package com.planforge.common.util;

/**
 * Result of bounding a user supplied string. {@code value} may be null when the input was null.
 */
public record TruncatedText(String value, boolean truncated, int originalLength) {

    public static TruncatedText of(String input, int maxLength) {
        if (input == null) {
            return new TruncatedText(null, false, 0);
        }
        String trimmed = input.trim();
        if (trimmed.length() <= maxLength) {
            return new TruncatedText(trimmed, false, trimmed.length());
        }
        return new TruncatedText(trimmed.substring(0, maxLength), true, trimmed.length());
    }

    public static TruncatedText ofOptional(String input, int maxLength) {
        if (input == null || input.isBlank()) {
            return new TruncatedText(null, false, 0);
        }
        return of(input, maxLength);
    }
}
