package com.omega.hoa.parser;

import org.junit.jupiter.api.Test;

import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.HoaParseException;
import com.omega.hoa.model.BooleanFormula;

import static com.omega.hoa.model.BooleanFormula.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AcceptanceFormulaParser.
 */
class AcceptanceFormulaParserTest {

    @Test
    void testParseInfFinAndConstants() {
        BooleanFormula formula = parse("Inf(0) & Fin(1) | t");

        assertThat(formula).isEqualTo(or(and(inf(0), fin(1)), TRUE));
    }

    @Test
    void testParseComplementedSets() {
        assertThat(parse("Fin(!2)")).isEqualTo(fin(2, true, null));
        assertThat(parse("Inf(!0)").toString()).isEqualTo("Inf(!0)");
    }

    @Test
    void testNegationIsPushedIntoAtoms() {
        BooleanFormula formula = parse("!(Inf(0) & Fin(1))");

        assertThat(formula).isEqualTo(or(fin(0), inf(1)));
    }

    @Test
    void testStreettStylePrecedence() {
        BooleanFormula formula = parse("(Fin(0) | Inf(1)) & (Fin(2) | Inf(3))");

        assertThat(formula.toString()).isEqualTo("(Fin(0) | Inf(1)) & (Fin(2) | Inf(3))");
    }

    @Test
    void testMissingParenthesisAfterInfIsSyntaxError() {
        assertThatThrownBy(() -> parse("Inf 0"))
                .isInstanceOf(HoaParseException.class)
                .hasMessageContaining("'(' after Inf");
    }

    @Test
    void testPropositionIsNotAnAcceptanceAtom() {
        assertThatThrownBy(() -> parse("0"))
                .isInstanceOf(HoaParseException.class)
                .hasMessageContaining("Expected Inf(..), Fin(..)");
    }

    private BooleanFormula parse(String text) {
        TokenCursor cursor = new TokenCursor(new HoaLexer(text).tokenize(new Diagnostics()));
        return new AcceptanceFormulaParser(cursor).parse();
    }
}
