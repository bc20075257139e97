package com.omega.hoa.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.omega.hoa.model.BooleanFormula;

/**
 * Resolved aliases in declaration order. Every formula is over atomic propositions only.
 * Aliases whose definition could not be resolved are remembered so later references to them
 * are not reported a second time.
 */
public class AliasTable {

    private final Map<String, BooleanFormula> resolved;
    private final Set<String> unresolvable;

    AliasTable(Map<String, BooleanFormula> resolved, Set<String> unresolvable) {
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
        this.unresolvable = Set.copyOf(unresolvable);
    }

    public static AliasTable empty() {
        return new AliasTable(Map.of(), Set.of());
    }

    public Optional<BooleanFormula> get(String name) {
        return Optional.ofNullable(resolved.get(name));
    }

    public boolean isDeclared(String name) {
        return resolved.containsKey(name) || unresolvable.contains(name);
    }

    public Map<String, BooleanFormula> asMap() {
        return resolved;
    }

    public int size() {
        return resolved.size();
    }
}
