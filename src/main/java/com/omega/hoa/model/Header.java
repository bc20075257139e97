package com.omega.hoa.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Header of one automaton as parsed. Filled item by item by the header parser; formulas
 * may still contain alias references.
 */
@Data
@NoArgsConstructor
public class Header {
    private String version;
    /** Null when no {@code AP:} line was given, which means zero propositions. */
    private Integer apCount;
    private List<String> apNames = new ArrayList<>();
    /** Null when the state count is unspecified. */
    private Integer stateCount;
    private List<StartSet> startSets = new ArrayList<>();
    private Integer acceptanceCount;
    private BooleanFormula acceptanceCondition;
    private AcceptanceNameHint acceptanceName;
    private List<AliasDefinition> aliases = new ArrayList<>();
    private Set<PropertyFlag> properties = EnumSet.noneOf(PropertyFlag.class);
    private List<String> unknownProperties = new ArrayList<>();
    private ToolInfo tool;
    private String name;
    /** Unknown header items in order of appearance, values kept as written. */
    private Map<String, List<String>> miscItems = new LinkedHashMap<>();
    /** Span of each header item keyword, keyed by item name. Repeated items keep the first. */
    private Map<String, Span> itemSpans = new HashMap<>();

    public int effectiveApCount() {
        return apCount == null ? 0 : apCount;
    }

    public int effectiveAcceptanceCount() {
        return acceptanceCount == null ? 0 : acceptanceCount;
    }

    public boolean hasProperty(PropertyFlag flag) {
        return properties.contains(flag);
    }

    public Span spanOf(String item) {
        return itemSpans.get(item);
    }
}
