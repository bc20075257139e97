package com.omega.hoa.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import lombok.experimental.UtilityClass;

/**
 * Structural helpers over {@link BooleanFormula} trees.
 */
@UtilityClass
public class Formulas {

    /**
     * Negation pushed down to the leaves. {@code Inf} and {@code Fin} are swapped instead of
     * being wrapped, so an acceptance condition stays in the positive HOA grammar.
     */
    public BooleanFormula negate(BooleanFormula formula) {
        return formula.accept(new BooleanFormulaVisitor<BooleanFormula>() {
            @Override
            public BooleanFormula visit(BooleanFormula.Constant constant) {
                return BooleanFormula.constant(!constant.isValue(), constant.getSpan());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.Var var) {
                return BooleanFormula.not(var, var.getSpan());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.Not not) {
                return negationNormalForm(not.getOperand());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.And and) {
                return BooleanFormula.or(map(and.getOperands(), Formulas::negate), and.getSpan());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.Or or) {
                return BooleanFormula.and(map(or.getOperands(), Formulas::negate), or.getSpan());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.AliasRef alias) {
                return BooleanFormula.not(alias, alias.getSpan());
            }

            @Override
            public BooleanFormula visit(BooleanFormula.AcceptanceAtom atom) {
                return atom.getType() == BooleanFormula.AcceptanceAtom.Type.INF
                        ? BooleanFormula.fin(atom.getSet(), atom.isComplemented(), atom.getSpan())
                        : BooleanFormula.inf(atom.getSet(), atom.isComplemented(), atom.getSpan());
            }
        });
    }

    public BooleanFormula negationNormalForm(BooleanFormula formula) {
        if (formula instanceof BooleanFormula.Not not) {
            return negate(not.getOperand());
        }
        if (formula instanceof BooleanFormula.And and) {
            return BooleanFormula.and(map(and.getOperands(), Formulas::negationNormalForm), and.getSpan());
        }
        if (formula instanceof BooleanFormula.Or or) {
            return BooleanFormula.or(map(or.getOperands(), Formulas::negationNormalForm), or.getSpan());
        }
        return formula;
    }

    public boolean containsAliases(BooleanFormula formula) {
        return !aliases(formula).isEmpty();
    }

    public List<BooleanFormula.AliasRef> aliases(BooleanFormula formula) {
        return collect(formula, BooleanFormula.AliasRef.class);
    }

    public List<BooleanFormula.Var> variables(BooleanFormula formula) {
        return collect(formula, BooleanFormula.Var.class);
    }

    public List<BooleanFormula.AcceptanceAtom> acceptanceAtoms(BooleanFormula formula) {
        return collect(formula, BooleanFormula.AcceptanceAtom.class);
    }

    private <T extends BooleanFormula> List<T> collect(BooleanFormula formula, Class<T> type) {
        List<T> found = new ArrayList<>();
        walk(formula, node -> {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
        });
        return found;
    }

    /**
     * Pre-order traversal.
     */
    public void walk(BooleanFormula formula, Consumer<BooleanFormula> action) {
        action.accept(formula);
        if (formula instanceof BooleanFormula.Not not) {
            walk(not.getOperand(), action);
        } else if (formula instanceof BooleanFormula.And and) {
            and.getOperands().forEach(operand -> walk(operand, action));
        } else if (formula instanceof BooleanFormula.Or or) {
            or.getOperands().forEach(operand -> walk(operand, action));
        }
    }

    private List<BooleanFormula> map(List<BooleanFormula> operands,
                                     UnaryOperator<BooleanFormula> fn) {
        List<BooleanFormula> mapped = new ArrayList<>(operands.size());
        for (BooleanFormula operand : operands) {
            mapped.add(fn.apply(operand));
        }
        return mapped;
    }
}
