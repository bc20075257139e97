package com.omega.hoa.output;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.config.AliasPolicy;
import com.omega.hoa.config.HoaWriterConfig;
import com.omega.hoa.model.Automaton;
import com.omega.hoa.model.Edge;
import com.omega.hoa.model.FormulaPrinter;
import com.omega.hoa.model.PropertyFlag;
import com.omega.hoa.model.State;
import com.omega.hoa.symbolic.Guard;
import com.omega.hoa.symbolic.LabelSpace;

/**
 * Renders automata as canonical HOA text.
 *
 * Header items come in a fixed order and guards are written in disjunctive normal form, so two
 * equivalent automata read into the same context print identically. Labeling properties are
 * rewritten to match the labels actually emitted.
 */
public class HoaWriter {
    private static final Logger log = LoggerFactory.getLogger(HoaWriter.class);

    private static final Set<PropertyFlag> LABELING_PROPERTIES = EnumSet.of(
        PropertyFlag.STATE_LABELS, PropertyFlag.TRANS_LABELS,
        PropertyFlag.IMPLICIT_LABELS, PropertyFlag.EXPLICIT_LABELS
    );

    /** Upper bound on propositions for which implicit emission is attempted. */
    private static final int MAX_IMPLICIT_PROPOSITIONS = 16;

    private enum Labels { IMPLICIT, STATE, TRANSITION, NONE }

    private final HoaWriterConfig config;

    public HoaWriter() {
        this(HoaWriterConfig.defaults());
    }

    public HoaWriter(HoaWriterConfig config) {
        this.config = config;
    }

    public String write(Automaton automaton) {
        StringBuilder out = new StringBuilder();
        Labels labels = chooseLabels(automaton);
        Map<String, Guard> aliases = config.getAliasPolicy() == AliasPolicy.EXTRACT
                ? automaton.getAliases()
                : Map.of();

        writeHeader(automaton, labels, aliases, out);
        out.append("--BODY--\n");
        for (State state : automaton.getStates()) {
            writeState(state, labels, aliases, out);
        }
        out.append("--END--\n");

        log.debug("Wrote automaton '{}' with {} labels", automaton.getName(), labels);
        return out.toString();
    }

    public String writeAll(Collection<Automaton> automata) {
        return automata.stream().map(this::write).collect(Collectors.joining());
    }

    private void writeHeader(Automaton automaton, Labels labels, Map<String, Guard> aliases, StringBuilder out) {
        out.append("HOA: v1\n");
        if (automaton.getName() != null) {
            out.append("name: ").append(quote(automaton.getName())).append('\n');
        }
        if (automaton.getTool() != null) {
            out.append("tool: ").append(quote(automaton.getTool().getName()));
            if (automaton.getTool().getVersion() != null) {
                out.append(' ').append(quote(automaton.getTool().getVersion()));
            }
            out.append('\n');
        }
        out.append("States: ").append(automaton.getStateCount()).append('\n');
        for (Set<Integer> start : automaton.getStartSets()) {
            out.append("Start: ").append(join(start, "&")).append('\n');
        }
        out.append("AP: ").append(automaton.apCount());
        for (String ap : automaton.getApNames()) {
            out.append(' ').append(quote(ap));
        }
        out.append('\n');
        for (Map.Entry<String, Guard> alias : aliases.entrySet()) {
            out.append("Alias: ").append(alias.getKey()).append(' ')
                    .append(FormulaPrinter.print(alias.getValue().toFormula())).append('\n');
        }
        if (automaton.getAcceptanceName() != null) {
            out.append("acc-name: ").append(automaton.getAcceptanceName()).append('\n');
        }
        out.append("Acceptance: ").append(automaton.getAcceptance().getSetCount()).append(' ')
                .append(FormulaPrinter.print(automaton.getAcceptance().getFormula())).append('\n');

        List<String> properties = properties(automaton, labels);
        if (!properties.isEmpty()) {
            out.append("properties: ").append(String.join(" ", properties)).append('\n');
        }
        for (Map.Entry<String, List<String>> item : automaton.getMiscItems().entrySet()) {
            out.append(item.getKey()).append(':');
            item.getValue().forEach(value -> out.append(' ').append(value));
            out.append('\n');
        }
    }

    private void writeState(State state, Labels labels, Map<String, Guard> aliases, StringBuilder out) {
        out.append("State: ");
        if (labels == Labels.STATE && state.getLabel() != null) {
            out.append('[').append(guard(state.getLabel(), aliases)).append("] ");
        }
        out.append(state.getId());
        if (config.isIncludeStateNames() && state.getName() != null) {
            out.append(' ').append(quote(state.getName()));
        }
        appendMarks(state.getAccMarks(), out);
        out.append('\n');

        for (Edge edge : state.getEdges()) {
            if (labels == Labels.TRANSITION) {
                out.append('[').append(guard(edge.getGuard(), aliases)).append("] ");
            }
            out.append(join(edge.getTargets(), "&"));
            appendMarks(edge.getAccMarks(), out);
            out.append('\n');
        }
    }

    private Labels chooseLabels(Automaton automaton) {
        if (automaton.getStates().stream().allMatch(s -> s.getEdges().isEmpty())) {
            return Labels.NONE;
        }
        if (config.isImplicitLabels() && isCanonicalEnumeration(automaton)) {
            return Labels.IMPLICIT;
        }
        boolean stateLabeled = automaton.getStates().stream().allMatch(state -> state.getEdges().isEmpty()
                || (state.getLabel() != null
                        && state.getEdges().stream().allMatch(e -> e.getGuard().equals(state.getLabel()))));
        return stateLabeled ? Labels.STATE : Labels.TRANSITION;
    }

    /**
     * True when every state has one edge per valuation, in implicit-label order.
     */
    private static boolean isCanonicalEnumeration(Automaton automaton) {
        int apCount = automaton.apCount();
        if (apCount > MAX_IMPLICIT_PROPOSITIONS) {
            return false;
        }
        LabelSpace space = automaton.getStates().stream()
                .flatMap(s -> s.getEdges().stream())
                .findFirst()
                .map(e -> e.getGuard().getSpace())
                .orElseThrow();
        int rowCount = 1 << apCount;
        if (automaton.getStates().stream().anyMatch(state -> state.getEdges().size() != rowCount)) {
            return false;
        }
        for (int k = 0; k < rowCount; k++) {
            Guard row = space.valuation(k, apCount);
            for (State state : automaton.getStates()) {
                if (!state.getEdges().get(k).getGuard().equals(row)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static List<String> properties(Automaton automaton, Labels labels) {
        Set<PropertyFlag> flags = EnumSet.noneOf(PropertyFlag.class);
        flags.addAll(automaton.getProperties());
        flags.removeAll(LABELING_PROPERTIES);
        switch (labels) {
            case IMPLICIT -> flags.add(PropertyFlag.IMPLICIT_LABELS);
            case STATE -> {
                flags.add(PropertyFlag.STATE_LABELS);
                flags.add(PropertyFlag.EXPLICIT_LABELS);
            }
            case TRANSITION -> {
                flags.add(PropertyFlag.TRANS_LABELS);
                flags.add(PropertyFlag.EXPLICIT_LABELS);
            }
            case NONE -> {
            }
        }
        List<String> names = new ArrayList<>();
        flags.forEach(flag -> names.add(flag.getHoaName()));
        names.addAll(automaton.getUnknownProperties());
        return names;
    }

    private static String guard(Guard guard, Map<String, Guard> aliases) {
        for (Map.Entry<String, Guard> alias : aliases.entrySet()) {
            if (alias.getValue().equals(guard)) {
                return alias.getKey();
            }
        }
        return FormulaPrinter.print(guard.toFormula());
    }

    private static void appendMarks(Set<Integer> marks, StringBuilder out) {
        if (!marks.isEmpty()) {
            out.append(" {").append(join(marks, " ")).append('}');
        }
    }

    private static String join(Collection<Integer> values, String separator) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(separator));
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
