package com.omega.hoa.resolve;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.Severity;
import com.omega.hoa.model.AliasDefinition;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.BooleanFormulaVisitor;

/**
 * Expands {@code Alias:} definitions into formulas over atomic propositions.
 *
 * Aliases are resolved in declaration order and memoized. A definition may only use aliases
 * declared before it; a reference chain that comes back to an alias still being resolved is
 * reported with the full cycle. Diagnostics are written to {@link Diagnostics}.
 */
public class AliasResolver {
    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final Map<String, AliasDefinition> definitions = new LinkedHashMap<>();

    /** Resolved formulas by alias name. */
    private final Map<String, BooleanFormula> resolved = new LinkedHashMap<>();

    private final Set<String> unresolvable = new HashSet<>();

    /** Tracks the recursion stack, in order, to detect and name cycles. */
    private final Set<String> currentlyResolving = new LinkedHashSet<>();

    /**
     * Resolve every definition. Repeated names keep their first definition.
     */
    public AliasTable resolve(List<AliasDefinition> aliases, Diagnostics diagnostics) {
        Objects.requireNonNull(aliases, "aliases");
        Objects.requireNonNull(diagnostics, "diagnostics");

        for (AliasDefinition alias : aliases) {
            AliasDefinition previous = definitions.putIfAbsent(alias.getName(), alias);
            if (previous != null) {
                diagnostics.report(Diagnostic.builder()
                        .severity(Severity.ERROR)
                        .kind(DiagnosticKind.DUPLICATE_ALIAS)
                        .message("Alias " + alias.getName() + " is already defined")
                        .span(alias.getSpan())
                        .span(previous.getSpan())
                        .build());
            }
        }

        for (AliasDefinition alias : definitions.values()) {
            resolveAlias(alias, diagnostics);
        }

        return new AliasTable(resolved, unresolvable);
    }

    /**
     * Replace every alias reference in {@code formula} by its resolved definition. References
     * to undeclared aliases are reported and read as {@code f}.
     */
    public static BooleanFormula expand(BooleanFormula formula, AliasTable table, Diagnostics diagnostics) {
        return formula.accept(new Substitution() {
            @Override
            public BooleanFormula visit(BooleanFormula.AliasRef alias) {
                if (table.get(alias.getName()).isPresent()) {
                    return table.get(alias.getName()).get();
                }
                if (!table.isDeclared(alias.getName())) {
                    reportUnknown(alias, diagnostics);
                }
                return BooleanFormula.FALSE;
            }
        });
    }

    private BooleanFormula resolveAlias(AliasDefinition alias, Diagnostics diagnostics) {
        String name = alias.getName();
        if (resolved.containsKey(name)) {
            return resolved.get(name);
        }
        if (unresolvable.contains(name)) {
            return null;
        }

        currentlyResolving.add(name);
        try {
            boolean[] failed = {false};
            BooleanFormula body = alias.getFormula().accept(new Substitution() {
                @Override
                public BooleanFormula visit(BooleanFormula.AliasRef ref) {
                    BooleanFormula target = resolveReference(alias, ref, diagnostics);
                    if (target == null) {
                        failed[0] = true;
                        return BooleanFormula.FALSE;
                    }
                    return target;
                }
            });

            if (failed[0]) {
                unresolvable.add(name);
                return null;
            }
            resolved.put(name, body);
            log.debug("Resolved alias {} -> {}", name, body);
            return body;
        } finally {
            currentlyResolving.remove(name);
        }
    }

    private BooleanFormula resolveReference(AliasDefinition owner, BooleanFormula.AliasRef ref,
                                            Diagnostics diagnostics) {
        String name = ref.getName();
        AliasDefinition target = definitions.get(name);
        if (target == null) {
            reportUnknown(ref, diagnostics);
            return null;
        }

        // Cycle detection
        if (currentlyResolving.contains(name)) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.CYCLIC_ALIAS, ref.getSpan(),
                    "Alias cycle: " + describeCycle(name)));
            return null;
        }

        BooleanFormula formula = resolveAlias(target, diagnostics);
        if (formula == null) {
            return null;
        }
        if (target.getDeclarationIndex() > owner.getDeclarationIndex()) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.CYCLIC_ALIAS, ref.getSpan(),
                    "Alias " + name + " is used by " + owner.getName() + " before its declaration")
                    .withHint("declare " + name + " before " + owner.getName()));
            return null;
        }
        return formula;
    }

    private String describeCycle(String revisited) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String name : currentlyResolving) {
            inCycle |= name.equals(revisited);
            if (inCycle) {
                cycle.add(name);
            }
        }
        cycle.add(revisited);
        return String.join(" -> ", cycle);
    }

    private static void reportUnknown(BooleanFormula.AliasRef ref, Diagnostics diagnostics) {
        diagnostics.report(Diagnostic.error(DiagnosticKind.UNKNOWN_ALIAS, ref.getSpan(),
                "Alias " + ref.getName() + " is not defined")
                .withHint("add a header line 'Alias: " + ref.getName() + " <formula>'"));
    }

    /**
     * Rebuilds a label formula, delegating alias leaves to the subclass.
     */
    private abstract static class Substitution implements BooleanFormulaVisitor<BooleanFormula> {

        @Override
        public BooleanFormula visit(BooleanFormula.Constant constant) {
            return constant;
        }

        @Override
        public BooleanFormula visit(BooleanFormula.Var var) {
            return var;
        }

        @Override
        public BooleanFormula visit(BooleanFormula.Not not) {
            return BooleanFormula.not(not.getOperand().accept(this), not.getSpan());
        }

        @Override
        public BooleanFormula visit(BooleanFormula.And and) {
            return BooleanFormula.and(map(and.getOperands()), and.getSpan());
        }

        @Override
        public BooleanFormula visit(BooleanFormula.Or or) {
            return BooleanFormula.or(map(or.getOperands()), or.getSpan());
        }

        @Override
        public BooleanFormula visit(BooleanFormula.AcceptanceAtom atom) {
            return atom;
        }

        private List<BooleanFormula> map(List<BooleanFormula> operands) {
            List<BooleanFormula> mapped = new ArrayList<>(operands.size());
            for (BooleanFormula operand : operands) {
                mapped.add(operand.accept(this));
            }
            return mapped;
        }
    }
}
