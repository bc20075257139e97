package com.omega.hoa.model;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Edge line of the body before validation.
 */
@Data
@Builder
public class RawEdge {
    /** Null when the edge is written without a label. */
    private BooleanFormula label;
    private List<Integer> targets;
    /** Null when no acceptance signature is written. */
    private List<Integer> accMarks;
    private Span span;
    private Span targetSpan;
    private Span accSpan;

    public boolean isUniversal() {
        return targets != null && targets.size() > 1;
    }
}
