package com.omega.hoa.model;

/**
 * Visitor pattern interface for traversing formula trees.
 */
public interface BooleanFormulaVisitor<R> {
    R visit(BooleanFormula.Constant constant);
    R visit(BooleanFormula.Var var);
    R visit(BooleanFormula.Not not);
    R visit(BooleanFormula.And and);
    R visit(BooleanFormula.Or or);
    R visit(BooleanFormula.AliasRef alias);
    R visit(BooleanFormula.AcceptanceAtom atom);
}
