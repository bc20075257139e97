package com.omega.hoa.output;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.omega.hoa.config.AliasPolicy;
import com.omega.hoa.config.HoaWriterConfig;
import com.omega.hoa.model.Automaton;
import com.omega.hoa.model.Edge;
import com.omega.hoa.model.LabelingMode;
import com.omega.hoa.model.ParseResult;
import com.omega.hoa.model.State;
import com.omega.hoa.parser.HoaReader;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HoaWriter.
 */
class HoaWriterTest {

    private static final String TWO_STATES = """
        HOA: v1
        States: 2
        Start: 0
        AP: 1 "a"
        Acceptance: 1 Inf(0)
        --BODY--
        State: 0
        [0] 1
        [!0] 0
        State: 1 {0}
        [t] 1
        --END--
        """;

    private final HoaReader reader = new HoaReader();

    @Test
    void testWriteCanonicalText() {
        String text = new HoaWriter().write(read(TWO_STATES));

        assertThat(text).isEqualTo("""
            HOA: v1
            States: 2
            Start: 0
            AP: 1 "a"
            Acceptance: 1 Inf(0)
            properties: trans-labels explicit-labels
            --BODY--
            State: 0
            [0] 1
            [!0] 0
            State: 1 {0}
            [t] 1
            --END--
            """);
    }

    @Test
    void testRoundTripPreservesSemantics() {
        Automaton original = read(TWO_STATES);
        String written = new HoaWriter().write(original);
        Automaton reread = read(written);

        assertThat(reread.getStateCount()).isEqualTo(original.getStateCount());
        assertThat(reread.getStartSets()).isEqualTo(original.getStartSets());
        assertThat(reread.getAcceptance().isEquivalentTo(original.getAcceptance())).isTrue();
        for (int id = 0; id < original.getStateCount(); id++) {
            State expected = original.state(id);
            State actual = reread.state(id);
            assertThat(actual.getAccMarks()).isEqualTo(expected.getAccMarks());
            assertThat(actual.getEdges()).extracting(Edge::getGuard)
                    .containsExactlyElementsOf(expected.getEdges().stream().map(Edge::getGuard).toList());
            assertThat(actual.getEdges()).extracting(Edge::getTargets)
                    .containsExactlyElementsOf(expected.getEdges().stream().map(Edge::getTargets).toList());
        }
        assertThat(new HoaWriter().write(reread)).isEqualTo(written);
    }

    @Test
    void testHeaderMetadataIsWritten() {
        Automaton automaton = read("""
            HOA: v1
            name: "a \\"quoted\\" name"
            tool: "hoa-omega" "1.0"
            States: 1
            Start: 0
            AP: 1 "p"
            acc-name: Buchi
            Acceptance: 1 Inf(0)
            properties: deterministic
            spot-extra: 1 "x"
            --BODY--
            State: 0 "s0" {0}
            [t] 0
            --END--
            """);

        assertThat(new HoaWriter().write(automaton)).isEqualTo("""
            HOA: v1
            name: "a \\"quoted\\" name"
            tool: "hoa-omega" "1.0"
            States: 1
            Start: 0
            AP: 1 "p"
            acc-name: Buchi
            Acceptance: 1 Inf(0)
            properties: trans-labels explicit-labels deterministic
            spot-extra: 1 "x"
            --BODY--
            State: 0 "s0" {0}
            [t] 0
            --END--
            """);
    }

    @Test
    void testStateNamesCanBeOmitted() {
        Automaton automaton = read(TWO_STATES.replace("State: 0", "State: 0 \"init\""));
        HoaWriterConfig config = HoaWriterConfig.builder().includeStateNames(false).build();

        assertThat(new HoaWriter().write(automaton)).contains("State: 0 \"init\"\n");
        assertThat(new HoaWriter(config).write(automaton)).contains("State: 0\n").doesNotContain("init");
    }

    @Test
    void testImplicitLabelsWhenRowsAreCanonical() {
        String text = """
            HOA: v1
            States: 2
            Start: 0
            AP: 1 "a"
            Acceptance: 0 t
            --BODY--
            State: 0
            [!0] 1
            [0] 0
            State: 1
            [!0] 1
            [0] 1
            --END--
            """;
        Automaton automaton = read(text);
        HoaWriterConfig config = HoaWriterConfig.builder().implicitLabels(true).build();

        String implicit = new HoaWriter(config).write(automaton);

        assertThat(implicit).contains("properties: implicit-labels\n")
                .contains("State: 0\n1\n0\nState: 1\n1\n1\n")
                .doesNotContain("[");
        Automaton reread = read(implicit);
        assertThat(reread.getLabelingMode()).isEqualTo(LabelingMode.IMPLICIT);
        assertThat(reread.state(0).getEdges()).extracting(Edge::getGuard)
                .containsExactlyElementsOf(automaton.state(0).getEdges().stream().map(Edge::getGuard).toList());

        assertThat(new HoaWriter().write(automaton)).contains("[!0] 1\n[0] 0\n");
    }

    @Test
    void testImplicitLabelsNotUsedForNonCanonicalOrder() {
        HoaWriterConfig config = HoaWriterConfig.builder().implicitLabels(true).build();

        String text = new HoaWriter(config).write(read(TWO_STATES));

        assertThat(text).contains("[0] 1").doesNotContain("implicit-labels");
    }

    @Test
    void testStateLabelsAreKept() {
        String text = """
            HOA: v1
            States: 2
            Start: 0
            AP: 1 "a"
            Acceptance: 1 Fin(0)
            --BODY--
            State: [0] 0
            1
            0 {0}
            State: [!0] 1
            1
            --END--
            """;

        String written = new HoaWriter().write(read(text));

        assertThat(written).isEqualTo(text.replace("--BODY--", "properties: state-labels explicit-labels\n--BODY--"));
    }

    @Test
    void testAliasPolicies() {
        Automaton automaton = read("""
            HOA: v1
            States: 2
            Start: 0
            AP: 2 "a" "b"
            Alias: @ab 0 & 1
            Acceptance: 0 t
            --BODY--
            State: 0
            [@ab] 1
            [!@ab] 0
            State: 1
            [t] 1
            --END--
            """);

        String inline = new HoaWriter().write(automaton);
        assertThat(inline).doesNotContain("Alias:").contains("[0 & 1] 1\n").contains("[0 & !1 | !0] 0\n");

        HoaWriterConfig extract = HoaWriterConfig.builder().aliasPolicy(AliasPolicy.EXTRACT).build();
        String extracted = new HoaWriter(extract).write(automaton);
        assertThat(extracted).contains("Alias: @ab 0 & 1\n").contains("[@ab] 1\n");
        assertThat(new HoaWriter(extract).write(read(extracted))).isEqualTo(extracted);
    }

    @Test
    void testUniversalBranchingIsWritten() {
        String written = new HoaWriter().write(read("""
            HOA: v1
            States: 3
            Start: 0&1
            AP: 0
            Acceptance: 0 t
            properties: univ-branch
            --BODY--
            State: 0
            [t] 2&1
            State: 1
            State: 2
            --END--
            """));

        assertThat(written).contains("Start: 0&1\n")
                .contains("[t] 1&2\n")
                .contains("properties: trans-labels explicit-labels univ-branch\n");
    }

    @Test
    void testAutomatonWithoutEdges() {
        String written = new HoaWriter().write(read("""
            HOA: v1
            States: 1
            Start: 0
            Acceptance: 0 t
            properties: deterministic
            --BODY--
            State: 0
            --END--
            """));

        assertThat(written).contains("AP: 0\n").contains("properties: deterministic\n").contains("State: 0\n--END--");
    }

    @Test
    void testUnknownPropertiesSurviveRoundTrip() {
        Automaton automaton = read(TWO_STATES.replace("--BODY--",
                "properties: shiny deterministic shiny\n--BODY--"));
        HoaWriter writer = new HoaWriter();

        String text = writer.write(automaton);

        assertThat(automaton.getUnknownProperties()).containsExactly("shiny");
        assertThat(text).contains("properties: trans-labels explicit-labels deterministic shiny\n");
        assertThat(writer.write(read(text))).isEqualTo(text);
    }

    @Test
    void testWriteAllConcatenates() {
        Automaton automaton = read(TWO_STATES);
        HoaWriter writer = new HoaWriter();

        String both = writer.writeAll(List.of(automaton, automaton));

        assertThat(both).isEqualTo(writer.write(automaton) + writer.write(automaton));
        assertThat(reader.readAll(both)).hasSize(2).allMatch(ParseResult::isAutomaton);
    }

    private Automaton read(String text) {
        ParseResult result = reader.read(text);
        assertThat(result.isAutomaton()).as("diagnostics: %s", result.getDiagnostics()).isTrue();
        return result.getAutomaton();
    }
}
