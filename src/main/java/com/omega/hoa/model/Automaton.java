package com.omega.hoa.model;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.omega.hoa.symbolic.AcceptanceCondition;
import com.omega.hoa.symbolic.Guard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Validated omega-automaton. Immutable; states are dense and indexed by id.
 */
@Value
@Builder
public class Automaton {
    String version;
    String name;
    ToolInfo tool;
    @Singular
    List<String> apNames;
    int stateCount;
    /** Each start set holds conjunctively; singletons for ordinary initial states. */
    @Singular
    List<Set<Integer>> startSets;
    int acceptanceCount;
    AcceptanceCondition acceptance;
    AcceptanceNameHint acceptanceName;
    @Singular("property")
    Set<PropertyFlag> properties;
    /** Properties outside the HOA vocabulary, kept verbatim for output. */
    @Singular
    List<String> unknownProperties;
    LabelingMode labelingMode;
    /** Declared aliases in declaration order, compiled; kept for re-extraction on output. */
    @Singular("alias")
    Map<String, Guard> aliases;
    @Singular("miscItem")
    Map<String, List<String>> miscItems;
    @Singular
    List<State> states;

    public int apCount() {
        return apNames.size();
    }

    public State state(int id) {
        return states.get(id);
    }

    public boolean hasProperty(PropertyFlag flag) {
        return properties.contains(flag);
    }

    public Optional<String> apName(int index) {
        return index >= 0 && index < apNames.size() ? Optional.of(apNames.get(index)) : Optional.empty();
    }

    /**
     * Outgoing edges of {@code stateId} enabled under {@code valuation}, in declaration order.
     */
    public List<Edge> enabledEdges(int stateId, BitSet valuation) {
        return state(stateId).getEdges().stream()
                .filter(edge -> edge.getGuard().evaluate(valuation))
                .toList();
    }

    public int edgeCount() {
        return states.stream().mapToInt(state -> state.getEdges().size()).sum();
    }
}
