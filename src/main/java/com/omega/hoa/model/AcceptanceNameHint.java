package com.omega.hoa.model;

import java.util.List;

import lombok.Value;

/**
 * Content of an {@code acc-name:} line. Informative only.
 */
@Value
public class AcceptanceNameHint {
    /** Name as written. */
    String rawName;
    /** Known scheme, or null when the name is not one of the standard ones. */
    AcceptanceName name;
    /** Parameters as written: integers, identifiers and booleans. */
    List<String> parameters;
    Span span;

    @Override
    public String toString() {
        return parameters.isEmpty() ? rawName : rawName + " " + String.join(" ", parameters);
    }
}
