package com.omega.hoa.config;

/**
 * How the writer treats the aliases an automaton was read with.
 */
public enum AliasPolicy {
    /** Write every guard out over proposition indices; no {@code Alias:} lines. */
    INLINE,
    /** Re-declare the aliases and use {@code @name} wherever a guard equals one. */
    EXTRACT
}
