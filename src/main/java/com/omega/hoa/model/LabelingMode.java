package com.omega.hoa.model;

/**
 * Where the guards of an automaton come from, as observed in its body.
 */
public enum LabelingMode {
    /** Labels attach to states and guard every outgoing edge. */
    STATE,
    /** Labels attach to edges. */
    TRANSITION,
    /** No labels; edge {@code k} of a state carries the {@code k}-th valuation. */
    IMPLICIT,
    /** No edges carry labels and none are needed. */
    NONE
}
