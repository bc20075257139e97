package com.omega.hoa.diagnostics;

/**
 * Classification of everything the pipeline can report about an automaton.
 */
public enum DiagnosticKind {
    /** Unrecognized character or malformed literal. */
    LEX_ERROR,
    /** Token where the grammar expects another one. */
    SYNTAX_ERROR,
    UNKNOWN_ALIAS,
    /** Alias that refers to itself, directly or transitively, or to a later alias. */
    CYCLIC_ALIAS,
    DUPLICATE_ALIAS,
    /** Atomic proposition, acceptance set or state id beyond its declared bound. */
    INDEX_OUT_OF_RANGE,
    /** Declared count disagrees with what the text provides. */
    COUNT_MISMATCH,
    DUPLICATE_STATE,
    UNDEFINED_STATE,
    LABELING_MODE_CONFLICT,
    ACCEPTANCE_MODE_CONFLICT,
    IMPLICIT_LABEL_COUNT,
    UNIV_BRANCH_NOT_DECLARED,
    MISSING_HEADER_ITEM,
    DUPLICATE_HEADER_ITEM,
    UNKNOWN_HEADER_ITEM,
    UNKNOWN_PROPERTY,
    PROPERTY_CONFLICT,
    UNSUPPORTED_VERSION,
    ACCEPTANCE_NAME_MISMATCH
}
