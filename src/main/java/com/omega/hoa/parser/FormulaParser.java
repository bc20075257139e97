package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.List;

import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Precedence climbing shared by label and acceptance formulas:
 * parentheses over {@code !} over {@code &} over {@code |}. Subclasses supply the atoms.
 */
abstract class FormulaParser {

    protected final TokenCursor cursor;

    protected FormulaParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public BooleanFormula parse() {
        return parseOr();
    }

    protected abstract BooleanFormula parseAtom();

    /**
     * Builds the negation of an already parsed operand.
     */
    protected abstract BooleanFormula negate(BooleanFormula operand, Span span);

    private BooleanFormula parseOr() {
        List<BooleanFormula> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (cursor.match(Type.OR)) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : BooleanFormula.or(operands, cover(operands));
    }

    private BooleanFormula parseAnd() {
        List<BooleanFormula> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (cursor.match(Type.AND)) {
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : BooleanFormula.and(operands, cover(operands));
    }

    private BooleanFormula parseUnary() {
        if (cursor.check(Type.NOT)) {
            Span bang = cursor.advance().getSpan();
            BooleanFormula operand = parseUnary();
            return negate(operand, bang.to(operand.getSpan()));
        }
        if (cursor.check(Type.LPAREN)) {
            Span open = cursor.advance().getSpan();
            BooleanFormula inner = parseOr();
            cursor.expect(Type.RPAREN, "')' to close '(' at " + open);
            return inner;
        }
        return parseAtom();
    }

    private static Span cover(List<BooleanFormula> operands) {
        Span first = operands.get(0).getSpan();
        Span last = operands.get(operands.size() - 1).getSpan();
        return first == null ? last : first.to(last);
    }
}
