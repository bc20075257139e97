package com.omega.hoa.model;

import java.util.List;

import lombok.Value;

/**
 * State ids of one {@code Start:} line, to be entered conjunctively.
 */
@Value
public class StartSet {
    List<Integer> states;
    Span span;

    public boolean isUniversal() {
        return states.size() > 1;
    }
}
