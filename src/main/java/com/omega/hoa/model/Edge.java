package com.omega.hoa.model;

import java.util.SortedSet;

import com.omega.hoa.symbolic.Guard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Edge {
    Guard guard;
    /** More than one target means universal branching. */
    @Singular
    SortedSet<Integer> targets;
    @Singular
    SortedSet<Integer> accMarks;

    public boolean isUniversal() {
        return targets.size() > 1;
    }

    /** Sole target of an existential edge. */
    public int target() {
        if (isUniversal()) {
            throw new IllegalStateException("Edge has " + targets.size() + " targets");
        }
        return targets.first();
    }
}
