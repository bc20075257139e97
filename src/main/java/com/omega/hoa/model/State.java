package com.omega.hoa.model;

import java.util.List;
import java.util.SortedSet;

import com.omega.hoa.symbolic.Guard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class State {
    int id;
    String name;
    /** Compiled state label, null unless the body is state-labeled. */
    Guard label;
    @Singular
    SortedSet<Integer> accMarks;
    @Singular
    List<Edge> edges;
}
