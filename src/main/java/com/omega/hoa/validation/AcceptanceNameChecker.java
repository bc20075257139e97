package com.omega.hoa.validation;

import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.AcceptanceName;
import com.omega.hoa.model.AcceptanceNameHint;
import com.omega.hoa.symbolic.AcceptanceCondition;
import com.omega.hoa.symbolic.SymbolicCompiler;

/**
 * Compares a declared acceptance condition with the shape its {@code acc-name:} announces.
 * The name is informative, so every finding is a warning.
 */
public class AcceptanceNameChecker {
    private static final Logger log = LoggerFactory.getLogger(AcceptanceNameChecker.class);

    private final SymbolicCompiler compiler;

    public AcceptanceNameChecker(SymbolicCompiler compiler) {
        this.compiler = compiler;
    }

    public void check(AcceptanceNameHint hint, AcceptanceCondition declared, Diagnostics diagnostics) {
        if (hint == null || declared == null) {
            return;
        }
        if (hint.getName() == null) {
            log.debug("acc-name '{}' is not a standard scheme; not checked", hint.getRawName());
            return;
        }

        OptionalLong setCount = AcceptanceShapes.setCount(hint);
        if (setCount.isEmpty()) {
            diagnostics.warning(DiagnosticKind.ACCEPTANCE_NAME_MISMATCH, hint.getSpan(),
                    "Parameters of 'acc-name: " + hint + "' do not fit the " + hint.getRawName() + " scheme");
            return;
        }
        if (setCount.getAsLong() != declared.getSetCount()) {
            diagnostics.warning(DiagnosticKind.ACCEPTANCE_NAME_MISMATCH, hint.getSpan(),
                    "'acc-name: " + hint + "' implies " + setCount.getAsLong()
                            + " acceptance set(s) but " + declared.getSetCount() + " are declared");
            return;
        }

        AcceptanceShapes.Shape expected = AcceptanceShapes.of(hint).orElseThrow();

        // Conventions for zero colors differ between producers.
        if (hint.getName() == AcceptanceName.PARITY && expected.getSetCount() == 0
                && (declared.isTrue() || declared.isFalse())) {
            return;
        }

        AcceptanceCondition canonical = compiler.compileAcceptance(expected.getCondition(), expected.getSetCount());
        if (!canonical.isEquivalentTo(declared)) {
            diagnostics.warning(DiagnosticKind.ACCEPTANCE_NAME_MISMATCH, hint.getSpan(),
                    "Acceptance condition " + declared.getFormula() + " is not 'acc-name: " + hint
                            + "', which means " + expected.getCondition());
        }
    }
}
