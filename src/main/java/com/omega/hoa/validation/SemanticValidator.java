package com.omega.hoa.validation;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.config.HoaParserConfig;
import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.Severity;
import com.omega.hoa.model.AliasDefinition;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Formulas;
import com.omega.hoa.model.Header;
import com.omega.hoa.model.LabelingMode;
import com.omega.hoa.model.PropertyFlag;
import com.omega.hoa.model.RawAutomaton;
import com.omega.hoa.model.RawEdge;
import com.omega.hoa.model.RawState;
import com.omega.hoa.model.Span;
import com.omega.hoa.model.StartSet;

/**
 * Cross-checks the header of an automaton against its body.
 *
 * Every check runs; problems are accumulated in {@link Diagnostics} rather than stopping at the
 * first one. Expects alias references in labels to be expanded already. Declared properties
 * other than the labeling, acceptance and branching ones are recorded but not verified.
 */
public class SemanticValidator {
    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    private static final PropertyFlag[][] CONFLICTING_PROPERTIES = {
        {PropertyFlag.UNIV_BRANCH, PropertyFlag.NO_UNIV_BRANCH},
        {PropertyFlag.IMPLICIT_LABELS, PropertyFlag.EXPLICIT_LABELS},
        {PropertyFlag.STATE_LABELS, PropertyFlag.TRANS_LABELS},
    };

    private final HoaParserConfig config;

    public SemanticValidator(HoaParserConfig config) {
        this.config = config;
    }

    public ValidationResult validate(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();

        checkHeaderItems(header, diagnostics);
        checkPropertyConflicts(header, diagnostics);
        checkAcceptanceIndices(header, diagnostics);
        for (AliasDefinition alias : header.getAliases()) {
            checkPropositionIndices(alias.getFormula(), header, diagnostics);
        }

        int stateCount = checkStates(automaton, diagnostics);
        checkStartSets(header, diagnostics);
        checkEdges(automaton, diagnostics);

        LabelingMode mode = determineLabelingMode(automaton, diagnostics);
        if (mode == LabelingMode.IMPLICIT) {
            checkImplicitEdgeCounts(automaton, diagnostics);
        }
        checkAcceptanceMode(automaton, diagnostics);

        log.debug("Validated automaton '{}': {} state(s), labeling {}, {} error(s)",
                header.getName(), stateCount, mode, diagnostics.getErrors().size());
        return new ValidationResult(mode, stateCount);
    }

    private void checkHeaderItems(Header header, Diagnostics diagnostics) {
        if (header.spanOf("HOA") != null && header.spanOf("Acceptance") == null) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.MISSING_HEADER_ITEM, header.spanOf("HOA"),
                    "Header has no 'Acceptance:' item").withHint("use 'Acceptance: 0 t' to accept every run"));
        }
        if (header.getApCount() != null && header.getApCount() != header.getApNames().size()) {
            diagnostics.error(DiagnosticKind.COUNT_MISMATCH, header.spanOf("AP"),
                    "AP: declares " + header.getApCount() + " proposition(s) but names "
                            + header.getApNames().size());
        }
    }

    private void checkPropertyConflicts(Header header, Diagnostics diagnostics) {
        for (PropertyFlag[] pair : CONFLICTING_PROPERTIES) {
            if (header.hasProperty(pair[0]) && header.hasProperty(pair[1])) {
                diagnostics.error(DiagnosticKind.PROPERTY_CONFLICT, header.spanOf("properties"),
                        "Properties '" + pair[0].getHoaName() + "' and '" + pair[1].getHoaName()
                                + "' contradict each other");
            }
        }
    }

    private void checkAcceptanceIndices(Header header, Diagnostics diagnostics) {
        if (header.getAcceptanceCondition() == null) {
            return;
        }
        int bound = header.effectiveAcceptanceCount();
        for (BooleanFormula.AcceptanceAtom atom : Formulas.acceptanceAtoms(header.getAcceptanceCondition())) {
            if (atom.getSet() >= bound) {
                diagnostics.error(DiagnosticKind.INDEX_OUT_OF_RANGE, atom.getSpan(),
                        acceptanceSetOutOfRange(atom.getSet(), bound));
            }
        }
    }

    private void checkPropositionIndices(BooleanFormula label, Header header, Diagnostics diagnostics) {
        int bound = header.effectiveApCount();
        for (BooleanFormula.Var var : Formulas.variables(label)) {
            if (var.getIndex() >= bound) {
                diagnostics.error(DiagnosticKind.INDEX_OUT_OF_RANGE, var.getSpan(),
                        "Atomic proposition index " + var.getIndex() + " is out of range (bound " + bound + ")");
            }
        }
    }

    private void checkAcceptanceMarks(List<Integer> marks, Span span, Header header, Diagnostics diagnostics) {
        if (marks == null) {
            return;
        }
        int bound = header.effectiveAcceptanceCount();
        for (int mark : marks) {
            if (mark >= bound) {
                diagnostics.error(DiagnosticKind.INDEX_OUT_OF_RANGE, span, acceptanceSetOutOfRange(mark, bound));
            }
        }
    }

    private static String acceptanceSetOutOfRange(int set, int bound) {
        return "Acceptance set index " + set + " is out of range (bound " + bound + ")";
    }

    /**
     * Returns the number of states the automaton has.
     */
    private int checkStates(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();
        Integer declared = header.getStateCount();

        Map<Integer, RawState> defined = new HashMap<>();
        for (RawState state : automaton.getStates()) {
            if (declared != null && state.getId() >= declared) {
                diagnostics.error(DiagnosticKind.INDEX_OUT_OF_RANGE, state.getIdSpan(),
                        stateOutOfRange(state.getId(), declared));
                continue;
            }
            RawState previous = defined.putIfAbsent(state.getId(), state);
            if (previous != null) {
                diagnostics.report(Diagnostic.builder()
                        .severity(Severity.ERROR)
                        .kind(DiagnosticKind.DUPLICATE_STATE)
                        .message("State " + state.getId() + " is defined more than once")
                        .span(state.getIdSpan())
                        .span(previous.getIdSpan())
                        .build());
            }
        }

        Map<Integer, Span> referenced = referencedStates(automaton);
        if (declared != null) {
            for (Map.Entry<Integer, Span> ref : referenced.entrySet()) {
                if (ref.getKey() >= declared) {
                    diagnostics.error(DiagnosticKind.INDEX_OUT_OF_RANGE, ref.getValue(),
                            stateOutOfRange(ref.getKey(), declared));
                }
            }
            if (defined.size() != declared) {
                diagnostics.error(DiagnosticKind.COUNT_MISMATCH, header.spanOf("States"),
                        "States: declares " + declared + " state(s) but the body defines " + defined.size());
            }
            return declared;
        }

        int count = 0;
        for (int id : defined.keySet()) {
            count = Math.max(count, id + 1);
        }
        for (Map.Entry<Integer, Span> ref : referenced.entrySet()) {
            count = Math.max(count, ref.getKey() + 1);
            if (!defined.containsKey(ref.getKey())) {
                diagnostics.warning(DiagnosticKind.UNDEFINED_STATE, ref.getValue(),
                        "State " + ref.getKey() + " is referenced but never defined; it has no edges");
            }
        }
        return count;
    }

    /**
     * First reference to every state id from start sets and edge targets.
     */
    private static Map<Integer, Span> referencedStates(RawAutomaton automaton) {
        Map<Integer, Span> referenced = new LinkedHashMap<>();
        for (StartSet start : automaton.getHeader().getStartSets()) {
            for (int id : start.getStates()) {
                referenced.putIfAbsent(id, start.getSpan());
            }
        }
        for (RawState state : automaton.getStates()) {
            for (RawEdge edge : state.getEdges()) {
                for (int id : edge.getTargets()) {
                    referenced.putIfAbsent(id, edge.getTargetSpan());
                }
            }
        }
        return referenced;
    }

    private static String stateOutOfRange(int id, int bound) {
        return "State " + id + " is out of range (bound " + bound + ")";
    }

    private void checkStartSets(Header header, Diagnostics diagnostics) {
        for (StartSet start : header.getStartSets()) {
            if (start.isUniversal() && !header.hasProperty(PropertyFlag.UNIV_BRANCH)) {
                diagnostics.report(Diagnostic.error(DiagnosticKind.UNIV_BRANCH_NOT_DECLARED, start.getSpan(),
                        "Conjunctive start set " + start.getStates() + " requires universal branching")
                        .withHint("add 'univ-branch' to properties:"));
            }
        }
    }

    private void checkEdges(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();
        for (RawState state : automaton.getStates()) {
            if (state.getLabel() != null) {
                checkPropositionIndices(state.getLabel(), header, diagnostics);
            }
            checkAcceptanceMarks(state.getAccMarks(), state.getAccSpan(), header, diagnostics);

            for (RawEdge edge : state.getEdges()) {
                if (edge.getLabel() != null) {
                    checkPropositionIndices(edge.getLabel(), header, diagnostics);
                }
                checkAcceptanceMarks(edge.getAccMarks(), edge.getAccSpan(), header, diagnostics);
                if (edge.isUniversal() && !header.hasProperty(PropertyFlag.UNIV_BRANCH)) {
                    diagnostics.report(Diagnostic.error(DiagnosticKind.UNIV_BRANCH_NOT_DECLARED, edge.getTargetSpan(),
                            "Edge of state " + state.getId() + " to " + edge.getTargets()
                                    + " uses universal branching")
                            .withHint("add 'univ-branch' to properties:"));
                }
            }
        }
    }

    private LabelingMode determineLabelingMode(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();
        List<RawState> states = automaton.getStates();

        boolean anyStateLabel = states.stream().anyMatch(s -> s.getLabel() != null);
        boolean anyEdgeLabel = states.stream()
                .flatMap(s -> s.getEdges().stream())
                .anyMatch(e -> e.getLabel() != null);
        boolean anyEdge = states.stream().anyMatch(s -> !s.getEdges().isEmpty());

        LabelingMode mode;
        if (anyStateLabel) {
            mode = LabelingMode.STATE;
            for (RawState state : states) {
                if (state.getLabel() == null && !state.getEdges().isEmpty()) {
                    diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, state.getIdSpan(),
                            "State " + state.getId() + " has no label although other states are labeled");
                }
                for (RawEdge edge : state.getEdges()) {
                    if (edge.getLabel() != null) {
                        diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, edge.getLabel().getSpan(),
                                "Edge label in an automaton with state labels");
                    }
                }
            }
        } else if (anyEdgeLabel) {
            mode = LabelingMode.TRANSITION;
            for (RawState state : states) {
                for (RawEdge edge : state.getEdges()) {
                    if (edge.getLabel() == null) {
                        diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, edge.getSpan(),
                                "Edge of state " + state.getId() + " has no label although other edges are labeled");
                    }
                }
            }
        } else if (anyEdge) {
            mode = LabelingMode.IMPLICIT;
            if (!header.hasProperty(PropertyFlag.IMPLICIT_LABELS)) {
                if (config.isInferImplicitLabels()) {
                    diagnostics.warning(DiagnosticKind.LABELING_MODE_CONFLICT, automaton.getSpan(),
                            "No edge carries a label; edges are read as implicitly labeled");
                } else {
                    diagnostics.report(Diagnostic.error(DiagnosticKind.LABELING_MODE_CONFLICT, automaton.getSpan(),
                            "Edges carry no labels").withHint("declare 'implicit-labels' in properties:"));
                }
            }
        } else {
            mode = LabelingMode.NONE;
        }

        Span properties = header.spanOf("properties");
        if (mode == LabelingMode.TRANSITION && header.hasProperty(PropertyFlag.STATE_LABELS)) {
            diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, properties,
                    "'state-labels' is declared but edges are labeled");
        }
        if (mode == LabelingMode.STATE && header.hasProperty(PropertyFlag.TRANS_LABELS)) {
            diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, properties,
                    "'trans-labels' is declared but states are labeled");
        }
        if ((mode == LabelingMode.STATE || mode == LabelingMode.TRANSITION)
                && header.hasProperty(PropertyFlag.IMPLICIT_LABELS)) {
            diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, properties,
                    "'implicit-labels' is declared but labels are written");
        }
        if (mode == LabelingMode.IMPLICIT && header.hasProperty(PropertyFlag.EXPLICIT_LABELS)) {
            diagnostics.error(DiagnosticKind.LABELING_MODE_CONFLICT, properties,
                    "'explicit-labels' is declared but no labels are written");
        }
        return mode;
    }

    private void checkImplicitEdgeCounts(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();
        int apCount = header.effectiveApCount();
        long rows = apCount < Long.SIZE - 1 ? 1L << apCount : Long.MAX_VALUE;
        String rowText = apCount < Long.SIZE - 1 ? Long.toString(rows) : "2^" + apCount;
        boolean complete = header.hasProperty(PropertyFlag.COMPLETE);
        for (RawState state : automaton.getStates()) {
            int edges = state.getEdges().size();
            if (edges > rows) {
                diagnostics.error(DiagnosticKind.IMPLICIT_LABEL_COUNT, state.getSpan(),
                        "State " + state.getId() + " has " + edges + " implicitly labeled edge(s) but "
                                + apCount + " proposition(s) allow only " + rowText);
            } else if (edges < rows && complete) {
                diagnostics.error(DiagnosticKind.IMPLICIT_LABEL_COUNT, state.getSpan(),
                        "State " + state.getId() + " has " + edges + " implicitly labeled edge(s) but the"
                                + " automaton is declared complete, which needs " + rowText);
            }
        }
    }

    private void checkAcceptanceMode(RawAutomaton automaton, Diagnostics diagnostics) {
        Header header = automaton.getHeader();
        boolean stateAcc = header.hasProperty(PropertyFlag.STATE_ACC);
        boolean transAcc = header.hasProperty(PropertyFlag.TRANS_ACC);
        for (RawState state : automaton.getStates()) {
            if (transAcc && state.getAccMarks() != null && !state.getAccMarks().isEmpty()) {
                diagnostics.warning(DiagnosticKind.ACCEPTANCE_MODE_CONFLICT, state.getAccSpan(),
                        "'trans-acc' is declared but state " + state.getId() + " carries acceptance marks");
            }
            for (RawEdge edge : state.getEdges()) {
                if (stateAcc && edge.getAccMarks() != null && !edge.getAccMarks().isEmpty()) {
                    diagnostics.warning(DiagnosticKind.ACCEPTANCE_MODE_CONFLICT, edge.getAccSpan(),
                            "'state-acc' is declared but an edge of state " + state.getId()
                                    + " carries acceptance marks");
                }
            }
        }
    }
}
