package com.omega.hoa.model;

import lombok.Value;

/**
 * Half-open character range of the source text, with the 1-based line and column of its start.
 */
@Value
public class Span {
    int start;
    int end;
    int line;
    int column;

    public static Span of(int start, int end, int line, int column) {
        return new Span(start, end, line, column);
    }

    /**
     * Smallest span covering this span and {@code other}.
     */
    public Span to(Span other) {
        if (other == null) {
            return this;
        }
        Span first = other.start < start ? other : this;
        return new Span(first.start, Math.max(end, other.end), first.line, first.column);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
