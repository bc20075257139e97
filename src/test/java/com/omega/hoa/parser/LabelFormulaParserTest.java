package com.omega.hoa.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.HoaParseException;
import com.omega.hoa.model.BooleanFormula;

import static com.omega.hoa.model.BooleanFormula.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LabelFormulaParser.
 */
class LabelFormulaParserTest {

    @Test
    void testNegationBindsTighterThanAndTighterThanOr() {
        BooleanFormula formula = parse("0 | 1 & !2");

        assertThat(formula).isEqualTo(or(var(0), and(var(1), not(var(2)))));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        BooleanFormula formula = parse("(0 | 1) & 2");

        assertThat(formula).isEqualTo(and(or(var(0), var(1)), var(2)));
    }

    @Test
    void testChainedOperatorsAreFlattened() {
        BooleanFormula formula = parse("0 & 1 & 2");

        assertThat(formula).isInstanceOf(BooleanFormula.And.class);
        assertThat(((BooleanFormula.And) formula).getOperands()).hasSize(3);
    }

    @Test
    void testDoubleNegationIsKept() {
        assertThat(parse("!!0")).isEqualTo(not(not(var(0))));
    }

    @Test
    void testConstantsAndAliases() {
        BooleanFormula formula = parse("@a & t | f");

        assertThat(formula).isEqualTo(or(and(alias("@a"), TRUE), FALSE));
    }

    @Test
    void testSpanCoversWholeExpression() {
        BooleanFormula formula = parse("0 & 12");

        assertThat(formula.getSpan().getStart()).isEqualTo(0);
        assertThat(formula.getSpan().getEnd()).isEqualTo(6);
    }

    @ParameterizedTest
    @CsvSource({
        "!(0 & 1) | 2, !(0 & 1) | 2",
        "((0 | 1)) & !2, (0 | 1) & !2",
        "0&1|2, 0 & 1 | 2",
        "0 & (1 | !2), 0 & (1 | !2)",
        "((3)), 3",
        "!!0, !!0",
        "@a & !t, @a & !t"
    })
    void testPrintsWithMinimalParentheses(String input, String expected) {
        assertThat(parse(input).toString()).isEqualTo(expected);
    }

    @Test
    void testUnclosedParenthesisIsSyntaxError() {
        assertThatThrownBy(() -> parse("(0 & 1"))
                .isInstanceOf(HoaParseException.class)
                .hasMessageContaining("')'")
                .satisfies(e -> assertThat(((HoaParseException) e).getDiagnostic().getKind())
                        .isEqualTo(DiagnosticKind.SYNTAX_ERROR));
    }

    @Test
    void testDanglingOperatorIsSyntaxError() {
        assertThatThrownBy(() -> parse("0 &"))
                .isInstanceOf(HoaParseException.class)
                .hasMessageContaining("end of input");
    }

    @Test
    void testAcceptanceAtomIsNotALabel() {
        assertThatThrownBy(() -> parse("Inf(0)"))
                .isInstanceOf(HoaParseException.class)
                .hasMessageContaining("'Inf'");
    }

    private BooleanFormula parse(String text) {
        TokenCursor cursor = new TokenCursor(new HoaLexer(text).tokenize(new Diagnostics()));
        return new LabelFormulaParser(cursor).parse();
    }
}
