package com.omega.hoa.validation;

import com.omega.hoa.model.LabelingMode;

import lombok.Value;

/**
 * Facts established by the validator that the builder relies on.
 */
@Value
public class ValidationResult {
    LabelingMode labelingMode;
    /** Declared state count, or one more than the largest id mentioned when undeclared. */
    int stateCount;
}
