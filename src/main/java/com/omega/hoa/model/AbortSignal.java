package com.omega.hoa.model;

import lombok.Value;

/**
 * A producer ended an automaton with {@code --ABORT--}. Not an error.
 */
@Value
public class AbortSignal {
    Span span;
    /** Zero-based position of the aborted item in its stream. */
    int automatonIndex;
    boolean headerSeen;
    boolean bodySeen;
    /** Value of the {@code name:} item if the header got that far. */
    String name;
}
