package com.omega.hoa.model;

import lombok.Value;

/**
 * One {@code Alias:} line as parsed, before resolution.
 */
@Value
public class AliasDefinition {
    String name;
    BooleanFormula formula;
    /** Position among the alias declarations of the header. */
    int declarationIndex;
    Span span;
}
