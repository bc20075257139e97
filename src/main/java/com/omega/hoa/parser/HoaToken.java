package com.omega.hoa.parser;

import com.omega.hoa.model.Span;

import lombok.Value;

/**
 * Represents a token produced by {@link HoaLexer}.
 */
@Value
public class HoaToken {
    Type type;
    /**
     * Source text of the token. Header keywords drop the trailing colon, strings are unescaped
     * and lose their quotes, aliases keep their {@code @}.
     */
    String text;
    Span span;

    public enum Type {
        HEADER,
        IDENTIFIER,
        INTEGER,
        STRING,
        ALIAS,
        TRUE,
        FALSE,
        INF,
        FIN,
        NOT,
        AND,
        OR,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        BODY,
        END,
        ABORT,
        EOF
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isHeader(String keyword) {
        return type == Type.HEADER && text.equals(keyword);
    }

    /**
     * Value of an {@link Type#INTEGER} token. The lexer only produces integers that fit.
     */
    public int intValue() {
        return Integer.parseInt(text);
    }

    /**
     * Human readable description used in syntax errors.
     */
    public String describe() {
        return switch (type) {
            case HEADER -> "'" + text + ":'";
            case STRING -> "string \"" + text + "\"";
            case INTEGER -> "integer " + text;
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
