package com.planforge.common.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LearningStyle {
    READING("reading", "articles, documentation and books"),
    VIDEO("video", "video lectures and walkthroughs"),
    PRACTICE("practice", "hands-on exercises and small projects"),
    MIXED("mixed", "a balanced mix of reading, video and practice");

    @JsonValue
    private final String value;
    private final String promptHint;

    @JsonCreator
    public static LearningStyle fromString(String name) {
        for (LearningStyle style : values()) {
            if (style.value.equalsIgnoreCase(name) || style.name().equalsIgnoreCase(name)) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unknown learning style: " + name);
    }
}
