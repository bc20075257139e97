package com.omega.hoa.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * {@code State:} block of the body before validation.
 */
@Data
@Builder
public class RawState {
    private int id;
    private Span idSpan;
    /** Optional name string. */
    private String name;
    private BooleanFormula label;
    private List<Integer> accMarks;
    private Span accSpan;
    @Builder.Default
    private List<RawEdge> edges = new ArrayList<>();
    private Span span;

    public void addEdge(RawEdge edge) {
        edges.add(edge);
    }
}
