package com.omega.hoa.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.parser.HoaToken.Type;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HoaLexer.
 */
class HoaLexerTest {

    @Test
    void testTokenizeHeaderLines() {
        List<HoaToken> tokens = tokenize("HOA: v1\nStates: 2\n");

        assertThat(tokens).extracting(HoaToken::getType)
                .containsExactly(Type.HEADER, Type.IDENTIFIER, Type.HEADER, Type.INTEGER, Type.EOF);
        assertThat(tokens.get(0).getText()).isEqualTo("HOA");
        assertThat(tokens.get(2).getText()).isEqualTo("States");
        assertThat(tokens.get(2).getSpan().getLine()).isEqualTo(2);
        assertThat(tokens.get(2).getSpan().getColumn()).isEqualTo(1);
        assertThat(tokens.get(3).intValue()).isEqualTo(2);
    }

    @Test
    void testTokenizeBodyMarkersAndOperators() {
        List<HoaToken> tokens = tokenize("--BODY-- [0 & !1 | t] 1&2 {0} --END-- --ABORT--");

        assertThat(tokens).extracting(HoaToken::getType).containsExactly(
                Type.BODY, Type.LBRACKET, Type.INTEGER, Type.AND, Type.NOT, Type.INTEGER, Type.OR,
                Type.TRUE, Type.RBRACKET, Type.INTEGER, Type.AND, Type.INTEGER, Type.LBRACE,
                Type.INTEGER, Type.RBRACE, Type.END, Type.ABORT, Type.EOF);
    }

    @Test
    void testKeywordsAndAliases() {
        List<HoaToken> tokens = tokenize("t f Inf Fin @a_1-x generalized-Buchi");

        assertThat(tokens).extracting(HoaToken::getType).containsExactly(
                Type.TRUE, Type.FALSE, Type.INF, Type.FIN, Type.ALIAS, Type.IDENTIFIER, Type.EOF);
        assertThat(tokens.get(4).getText()).isEqualTo("@a_1-x");
        assertThat(tokens.get(5).getText()).isEqualTo("generalized-Buchi");
    }

    @Test
    void testStringEscapes() {
        List<HoaToken> tokens = tokenize("name: \"say \\\"hi\\\" \\\\ bye\"");

        assertThat(tokens.get(1).getType()).isEqualTo(Type.STRING);
        assertThat(tokens.get(1).getText()).isEqualTo("say \"hi\" \\ bye");
    }

    @Test
    void testCommentsAreSkippedButLinesCounted() {
        List<HoaToken> tokens = tokenize("// line comment\n/* block /* nested */ still\n comment */ 3");

        assertThat(tokens).extracting(HoaToken::getType).containsExactly(Type.INTEGER, Type.EOF);
        assertThat(tokens.get(0).getSpan().getLine()).isEqualTo(3);
        assertThat(tokens.get(0).getSpan().getColumn()).isEqualTo(13);
    }

    @Test
    void testUnrecognizedInputIsReportedAndSkipped() {
        Diagnostics diagnostics = new Diagnostics();
        List<HoaToken> tokens = new HoaLexer("1 #junk 2").tokenize(diagnostics);

        assertThat(tokens).extracting(HoaToken::getText).containsExactly("1", "2", "");
        assertThat(diagnostics.getErrors()).hasSize(1);
        assertThat(diagnostics.getErrors().get(0).getKind()).isEqualTo(DiagnosticKind.LEX_ERROR);
        assertThat(diagnostics.getErrors().get(0).primarySpan().getColumn()).isEqualTo(3);
    }

    @Test
    void testUnterminatedStringIsLexError() {
        Diagnostics diagnostics = new Diagnostics();
        List<HoaToken> tokens = new HoaLexer("name: \"open").tokenize(diagnostics);

        assertThat(tokens).extracting(HoaToken::getType).containsExactly(Type.HEADER, Type.EOF);
        assertThat(diagnostics.contains(DiagnosticKind.LEX_ERROR)).isTrue();
    }

    @Test
    void testIntegerOverflowIsLexError() {
        Diagnostics diagnostics = new Diagnostics();
        new HoaLexer("States: 99999999999").tokenize(diagnostics);

        assertThat(diagnostics.getErrors()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("99999999999"));
    }

    @Test
    void testUnknownMarkerIsLexError() {
        Diagnostics diagnostics = new Diagnostics();
        List<HoaToken> tokens = new HoaLexer("--FOO-- 1").tokenize(diagnostics);

        assertThat(tokens).extracting(HoaToken::getType).containsExactly(Type.INTEGER, Type.EOF);
        assertThat(diagnostics.contains(DiagnosticKind.LEX_ERROR)).isTrue();
    }

    @Test
    void testLexingIsRestartable() {
        String text = "HOA: v1 AP: 1 \"a\" --BODY-- State: 0 [0] 0 --END--";

        assertThat(tokenize(text)).isEqualTo(tokenize(text));
    }

    @Test
    void testNextKeepsReturningEofAtEnd() {
        HoaLexer lexer = new HoaLexer("  ");
        Diagnostics diagnostics = new Diagnostics();

        assertThat(lexer.next(diagnostics).getType()).isEqualTo(Type.EOF);
        assertThat(lexer.next(diagnostics).getType()).isEqualTo(Type.EOF);
    }

    private List<HoaToken> tokenize(String text) {
        Diagnostics diagnostics = new Diagnostics();
        List<HoaToken> tokens = new HoaLexer(text).tokenize(diagnostics);
        assertThat(diagnostics.isEmpty()).as("unexpected diagnostics: %s", diagnostics).isTrue();
        return tokens;
    }
}
