package com.omega.hoa.parser;

import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Formulas;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Parses acceptance conditions over {@code Inf(i)}, {@code Fin(i)} and their complemented
 * forms {@code Inf(!i)}, {@code Fin(!i)}. A leading {@code !} on a sub-formula is accepted and
 * pushed into the atoms, so the result is always in the positive acceptance grammar.
 */
public class AcceptanceFormulaParser extends FormulaParser {

    public AcceptanceFormulaParser(TokenCursor cursor) {
        super(cursor);
    }

    @Override
    protected BooleanFormula parseAtom() {
        HoaToken token = cursor.peek();
        return switch (token.getType()) {
            case TRUE -> {
                cursor.advance();
                yield BooleanFormula.constant(true, token.getSpan());
            }
            case FALSE -> {
                cursor.advance();
                yield BooleanFormula.constant(false, token.getSpan());
            }
            case INF, FIN -> parseSetAtom();
            default -> throw cursor.error("Expected Inf(..), Fin(..), 't' or 'f' but found " + token.describe());
        };
    }

    private BooleanFormula parseSetAtom() {
        HoaToken keyword = cursor.advance();
        cursor.expect(Type.LPAREN, "'(' after " + keyword.getText());
        boolean complemented = cursor.match(Type.NOT);
        HoaToken set = cursor.expect(Type.INTEGER, "an acceptance set index");
        HoaToken close = cursor.expect(Type.RPAREN, "')'");
        Span span = keyword.getSpan().to(close.getSpan());
        return keyword.is(Type.INF)
                ? BooleanFormula.inf(set.intValue(), complemented, span)
                : BooleanFormula.fin(set.intValue(), complemented, span);
    }

    @Override
    protected BooleanFormula negate(BooleanFormula operand, Span span) {
        return Formulas.negate(operand);
    }
}
