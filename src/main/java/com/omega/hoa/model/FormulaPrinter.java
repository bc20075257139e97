package com.omega.hoa.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders formulas in HOA concrete syntax with the minimal parentheses the precedence
 * {@code !} over {@code &} over {@code |} needs.
 */
public final class FormulaPrinter implements BooleanFormulaVisitor<String> {

    private static final int OR = 1;
    private static final int AND = 2;
    private static final int UNARY = 3;

    private int context = OR;

    private FormulaPrinter() {
    }

    public static String print(BooleanFormula formula) {
        return new FormulaPrinter().render(formula, OR);
    }

    private String render(BooleanFormula formula, int precedence) {
        int saved = context;
        context = precedence;
        try {
            return formula.accept(this);
        } finally {
            context = saved;
        }
    }

    @Override
    public String visit(BooleanFormula.Constant constant) {
        return constant.isValue() ? "t" : "f";
    }

    @Override
    public String visit(BooleanFormula.Var var) {
        return Integer.toString(var.getIndex());
    }

    @Override
    public String visit(BooleanFormula.Not not) {
        return "!" + render(not.getOperand(), UNARY);
    }

    @Override
    public String visit(BooleanFormula.And and) {
        return join(and.getOperands(), " & ", AND);
    }

    @Override
    public String visit(BooleanFormula.Or or) {
        return join(or.getOperands(), " | ", OR);
    }

    @Override
    public String visit(BooleanFormula.AliasRef alias) {
        return alias.getName();
    }

    @Override
    public String visit(BooleanFormula.AcceptanceAtom atom) {
        String name = atom.getType() == BooleanFormula.AcceptanceAtom.Type.INF ? "Inf" : "Fin";
        return name + "(" + (atom.isComplemented() ? "!" : "") + atom.getSet() + ")";
    }

    private String join(List<BooleanFormula> operands, String separator, int precedence) {
        if (operands.isEmpty()) {
            return precedence == AND ? "t" : "f";
        }
        if (operands.size() == 1) {
            return render(operands.get(0), context);
        }
        int outer = context;
        String body = operands.stream()
                .map(operand -> render(operand, precedence + 1))
                .collect(Collectors.joining(separator));
        return outer > precedence ? "(" + body + ")" : body;
    }
}
