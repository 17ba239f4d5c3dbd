package com.planforge.llm.parser;

import lombok.Getter;

@Getter
public class ParserException extends RuntimeException {

    public enum Kind {
        /** Empty or syntactically broken document. */
        INVALID_JSON,
        /** Well-formed document that violates the curriculum shape or bounds. */
        VALIDATION
    }

    private final Kind kind;

    public ParserException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ParserException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ParserException validation(String message) {
        return new ParserException(Kind.VALIDATION, message);
    }
}
