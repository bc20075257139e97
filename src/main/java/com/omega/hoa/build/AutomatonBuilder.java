package com.omega.hoa.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.model.Automaton;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Edge;
import com.omega.hoa.model.Header;
import com.omega.hoa.model.LabelingMode;
import com.omega.hoa.model.RawAutomaton;
import com.omega.hoa.model.RawEdge;
import com.omega.hoa.model.RawState;
import com.omega.hoa.model.StartSet;
import com.omega.hoa.model.State;
import com.omega.hoa.resolve.AliasTable;
import com.omega.hoa.symbolic.AcceptanceCondition;
import com.omega.hoa.symbolic.Guard;
import com.omega.hoa.symbolic.SymbolicCompiler;
import com.omega.hoa.validation.ValidationResult;

/**
 * Assembles the immutable {@link Automaton} from a validated, alias-free raw automaton.
 * Must only be called when validation reported no errors.
 */
public class AutomatonBuilder {
    private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final SymbolicCompiler compiler;

    public AutomatonBuilder(SymbolicCompiler compiler) {
        this.compiler = compiler;
    }

    public Automaton build(RawAutomaton raw, AliasTable aliases, ValidationResult validation) {
        Header header = raw.getHeader();
        int apCount = header.effectiveApCount();
        compiler.getContext().getLabelSpace().ensureVariables(apCount);

        AcceptanceCondition acceptance = compiler.compileAcceptance(
                header.getAcceptanceCondition() == null ? BooleanFormula.TRUE : header.getAcceptanceCondition(),
                header.effectiveAcceptanceCount());

        List<Guard> implicitRows = validation.getLabelingMode() == LabelingMode.IMPLICIT
                ? compiler.implicitGuards(apCount, maxEdgeCount(raw))
                : List.of();

        State[] states = new State[validation.getStateCount()];
        for (RawState rawState : raw.getStates()) {
            states[rawState.getId()] = buildState(rawState, validation.getLabelingMode(), implicitRows);
        }
        for (int id = 0; id < states.length; id++) {
            if (states[id] == null) {
                states[id] = State.builder().id(id).build();
            }
        }

        Automaton.AutomatonBuilder automaton = Automaton.builder()
                .version(header.getVersion())
                .name(header.getName())
                .tool(header.getTool())
                .apNames(header.getApNames())
                .stateCount(states.length)
                .acceptanceCount(header.effectiveAcceptanceCount())
                .acceptance(acceptance)
                .acceptanceName(header.getAcceptanceName())
                .properties(header.getProperties())
                .unknownProperties(header.getUnknownProperties().stream().distinct().toList())
                .labelingMode(validation.getLabelingMode())
                .miscItems(header.getMiscItems())
                .states(List.of(states));

        for (StartSet start : header.getStartSets()) {
            automaton.startSet(Collections.unmodifiableSortedSet(new TreeSet<>(start.getStates())));
        }
        for (Map.Entry<String, BooleanFormula> alias : aliases.asMap().entrySet()) {
            automaton.alias(alias.getKey(), compiler.compileLabel(alias.getValue()));
        }

        Automaton result = automaton.build();
        log.debug("Built automaton '{}' with {} state(s) and {} edge(s)",
                result.getName(), result.getStateCount(), result.edgeCount());
        return result;
    }

    private State buildState(RawState raw, LabelingMode mode, List<Guard> implicitRows) {
        Guard stateLabel = raw.getLabel() == null ? null : compiler.compileLabel(raw.getLabel());

        List<Edge> edges = new ArrayList<>(raw.getEdges().size());
        for (int k = 0; k < raw.getEdges().size(); k++) {
            RawEdge rawEdge = raw.getEdges().get(k);
            Guard guard = switch (mode) {
                case STATE -> stateLabel;
                case TRANSITION -> compiler.compileLabel(rawEdge.getLabel());
                case IMPLICIT -> implicitRows.get(k);
                case NONE -> throw new IllegalStateException("Edge in an automaton without edges");
            };
            edges.add(Edge.builder()
                    .guard(guard)
                    .targets(rawEdge.getTargets())
                    .accMarks(marks(rawEdge.getAccMarks()))
                    .build());
        }

        return State.builder()
                .id(raw.getId())
                .name(raw.getName())
                .label(stateLabel)
                .accMarks(marks(raw.getAccMarks()))
                .edges(edges)
                .build();
    }

    private static int maxEdgeCount(RawAutomaton raw) {
        return raw.getStates().stream().mapToInt(state -> state.getEdges().size()).max().orElse(0);
    }

    private static SortedSet<Integer> marks(List<Integer> marks) {
        return marks == null ? new TreeSet<>() : new TreeSet<>(marks);
    }
}
