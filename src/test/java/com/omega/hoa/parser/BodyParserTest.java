package com.omega.hoa.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.RawEdge;
import com.omega.hoa.model.RawState;
import com.omega.hoa.parser.HoaToken.Type;

import static com.omega.hoa.model.BooleanFormula.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BodyParser.
 */
class BodyParserTest {

    @Test
    void testParseStatesAndLabeledEdges() {
        Diagnostics diagnostics = new Diagnostics();
        List<RawState> states = parse("""
            State: 0 "init" {0}
            [0] 1
            [!0] 0 {1 2}
            State: 1
            [t] 0&1
            --END--
            """, diagnostics);

        assertThat(diagnostics.isEmpty()).as(diagnostics.toString()).isTrue();
        assertThat(states).hasSize(2);

        RawState init = states.get(0);
        assertThat(init.getId()).isZero();
        assertThat(init.getName()).isEqualTo("init");
        assertThat(init.getAccMarks()).containsExactly(0);
        assertThat(init.getEdges()).extracting(RawEdge::getLabel).containsExactly(var(0), not(var(0)));
        assertThat(init.getEdges().get(1).getAccMarks()).containsExactly(1, 2);
        assertThat(init.getEdges().get(0).getAccMarks()).isNull();

        RawEdge universal = states.get(1).getEdges().get(0);
        assertThat(universal.getTargets()).containsExactly(0, 1);
        assertThat(universal.isUniversal()).isTrue();
        assertThat(states.get(1).getName()).isNull();
        assertThat(states.get(1).getAccMarks()).isNull();
    }

    @Test
    void testStateLabelAndUnlabeledEdges() {
        Diagnostics diagnostics = new Diagnostics();
        List<RawState> states = parse("""
            State: [0 & 1] 3 {0}
            2
            1
            """, diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(states).singleElement().satisfies(state -> {
            assertThat(state.getId()).isEqualTo(3);
            assertThat(state.getLabel()).isEqualTo(and(var(0), var(1)));
            assertThat(state.getEdges()).extracting(RawEdge::getLabel).containsOnlyNulls();
            assertThat(state.getEdges()).extracting(RawEdge::getTargets)
                    .containsExactly(List.of(2), List.of(1));
        });
    }

    @Test
    void testBrokenEdgeSkipsToNextState() {
        Diagnostics diagnostics = new Diagnostics();
        List<RawState> states = parse("""
            State: 0
            [0 1
            [t] 0
            State: 1
            [t] 1
            --END--
            """, diagnostics);

        assertThat(states).extracting(RawState::getId).containsExactly(0, 1);
        assertThat(states.get(0).getEdges()).isEmpty();
        assertThat(states.get(1).getEdges()).hasSize(1);
        assertThat(diagnostics.getErrors()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.SYNTAX_ERROR);
            assertThat(d.getMessage()).contains("']'");
            assertThat(d.primarySpan().getLine()).isEqualTo(2);
        });
    }

    @Test
    void testEdgeBeforeFirstStateIsReported() {
        Diagnostics diagnostics = new Diagnostics();
        List<RawState> states = parse("[t] 0\nState: 0\n[t] 0\n", diagnostics);

        assertThat(states).extracting(RawState::getId).containsExactly(0);
        assertThat(diagnostics.getErrors()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("'State:'"));
    }

    @Test
    void testStopsAtAbortMarker() {
        Diagnostics diagnostics = new Diagnostics();
        TokenCursor cursor = cursor("State: 0\n[t] 0\n--ABORT--\n", diagnostics);
        List<RawState> states = new BodyParser(cursor).parse(diagnostics);

        assertThat(states).hasSize(1);
        assertThat(cursor.peek().getType()).isEqualTo(Type.ABORT);
    }

    @Test
    void testEmptyBody() {
        assertThat(parse("--END--", new Diagnostics())).isEmpty();
    }

    private List<RawState> parse(String text, Diagnostics diagnostics) {
        return new BodyParser(cursor(text, diagnostics)).parse(diagnostics);
    }

    private TokenCursor cursor(String text, Diagnostics diagnostics) {
        return new TokenCursor(new HoaLexer(text).tokenize(diagnostics));
    }
}
