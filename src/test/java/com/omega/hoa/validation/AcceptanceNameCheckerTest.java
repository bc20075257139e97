package com.omega.hoa.validation;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.AcceptanceName;
import com.omega.hoa.model.AcceptanceNameHint;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.symbolic.SymbolicCompiler;
import com.omega.hoa.symbolic.SymbolicContext;

import static com.omega.hoa.model.BooleanFormula.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AcceptanceNameChecker and AcceptanceShapes.
 */
class AcceptanceNameCheckerTest {

    private SymbolicCompiler compiler;
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        compiler = new SymbolicCompiler(SymbolicContext.create());
        diagnostics = new Diagnostics();
    }

    @Test
    void testMatchingBuchi() {
        check("Buchi", inf(0), 1);

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void testMismatchingBuchiIsWarning() {
        check("Buchi", fin(0), 1);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getWarnings()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.ACCEPTANCE_NAME_MISMATCH);
        assertThat(diagnostics.getWarnings().get(0).getMessage()).contains("Fin(0)").contains("Inf(0)");
    }

    @Test
    void testEquivalentSpellingIsAccepted() {
        check("parity", or(inf(0), and(fin(1), inf(2))), 3, "min", "even", "3");
        check("parity", and(or(inf(0), fin(1)), or(inf(0), inf(2))), 3, "min", "even", "3");

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void testParityMaxOdd() {
        check("parity", and(fin(2), or(inf(1), fin(0))), 3, "max", "odd", "3");

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void testParityWithoutColorsAcceptsEitherConstant() {
        check("parity", TRUE, 0, "max", "even", "0");
        check("parity", FALSE, 0, "min", "odd", "0");

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void testSetCountMismatch() {
        check("generalized-Buchi", and(inf(0), inf(1)), 3, "2");

        assertThat(diagnostics.getWarnings()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("implies 2 acceptance set(s) but 3"));
    }

    @Test
    void testParametersThatDoNotFit() {
        check("Buchi", inf(0), 1, "3");
        check("parity", inf(0), 1, "max", "sideways", "1");
        check("Rabin", inf(0), 1, "x");

        assertThat(diagnostics.getWarnings()).hasSize(3)
                .allSatisfy(d -> assertThat(d.getMessage()).contains("do not fit"));
    }

    @Test
    void testHugeSchemesAreComparedBySetCountOnly() {
        check("parity", inf(0), 1, "max", "even", "2000000000");
        check("Streett", inf(0), 1, "2000000000");
        check("generalized-Rabin", inf(0), 1, "1", "2147483647");

        assertThat(diagnostics.getWarnings()).extracting(Diagnostic::getMessage).containsExactly(
                "'acc-name: parity max even 2000000000' implies 2000000000 acceptance set(s) but 1 are declared",
                "'acc-name: Streett 2000000000' implies 4000000000 acceptance set(s) but 1 are declared",
                "'acc-name: generalized-Rabin 1 2147483647' implies 2147483648 acceptance set(s) but 1 are declared");
    }

    @Test
    void testSetCountFromParameters() {
        assertThat(AcceptanceShapes.setCount(hint("Rabin", "3"))).hasValue(6);
        assertThat(AcceptanceShapes.setCount(hint("generalized-Rabin", "2", "1", "2"))).hasValue(5);
        assertThat(AcceptanceShapes.setCount(hint("parity", "min", "odd", "4"))).hasValue(4);
        assertThat(AcceptanceShapes.setCount(hint("all"))).hasValue(0);
        assertThat(AcceptanceShapes.setCount(hint("parity", "min", "odd", "-1"))).isEmpty();
        assertThat(AcceptanceShapes.setCount(hint("Rabin", "99999999999"))).isEmpty();
        assertThat(AcceptanceShapes.of(hint("generalized-Buchi", "-2"))).isEmpty();
    }

    @Test
    void testUnknownNameIsNotChecked() {
        check("my-acceptance", inf(0), 1, "7");

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void testNamedShapes() {
        assertThat(AcceptanceShapes.streett(2).getCondition())
                .isEqualTo(and(or(fin(0), inf(1)), or(fin(2), inf(3))));
        assertThat(AcceptanceShapes.rabin(1).getCondition()).isEqualTo(and(fin(0), inf(1)));
        assertThat(AcceptanceShapes.generalizedCoBuchi(1).getCondition()).isEqualTo(fin(0));
        assertThat(AcceptanceShapes.generalizedBuchi(0).getCondition()).isEqualTo(TRUE);
        assertThat(AcceptanceShapes.parity(false, true, 0).getCondition()).isEqualTo(FALSE);
    }

    @Test
    void testGeneralizedRabinShape() {
        AcceptanceShapes.Shape shape = AcceptanceShapes.of(hint("generalized-Rabin", "2", "1", "2")).orElseThrow();

        assertThat(shape.getSetCount()).isEqualTo(5);
        assertThat(shape.getCondition()).isEqualTo(or(and(fin(0), inf(1)), and(fin(2), inf(3), inf(4))));
        assertThat(AcceptanceShapes.of(hint("generalized-Rabin", "2", "1"))).isEmpty();
    }

    @Test
    void testAllAndNone() {
        check("all", TRUE, 0);
        check("none", FALSE, 0);

        assertThat(diagnostics.isEmpty()).isTrue();
    }

    private void check(String name, BooleanFormula declared, int setCount, String... params) {
        new AcceptanceNameChecker(compiler).check(hint(name, params),
                compiler.compileAcceptance(declared, setCount), diagnostics);
    }

    private static AcceptanceNameHint hint(String name, String... params) {
        return new AcceptanceNameHint(name, AcceptanceName.fromHoa(name).orElse(null), List.of(params), null);
    }
}
