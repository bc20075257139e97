package com.omega.hoa.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Header and body of one automaton as parsed, before alias resolution and validation.
 * Transient: produced and consumed within a single read.
 */
@Data
@Builder
public class RawAutomaton {

    public enum Terminator { END, ABORT, MISSING }

    private Header header;
    @Builder.Default
    private List<RawState> states = new ArrayList<>();
    private boolean headerSeen;
    private boolean bodySeen;
    private Terminator terminator;
    /** Span of the end marker, or of the point where the automaton was cut off. */
    private Span terminatorSpan;
    private Span span;

    public boolean isAborted() {
        return terminator == Terminator.ABORT;
    }
}
