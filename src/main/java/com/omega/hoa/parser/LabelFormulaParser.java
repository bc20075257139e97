package com.omega.hoa.parser;

import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Parses label expressions: {@code t}, {@code f}, proposition indices and {@code @alias}
 * references combined with {@code !}, {@code &} and {@code |}. Index bounds are not checked here.
 */
public class LabelFormulaParser extends FormulaParser {

    public LabelFormulaParser(TokenCursor cursor) {
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
            case INTEGER -> {
                cursor.advance();
                yield BooleanFormula.var(token.intValue(), token.getSpan());
            }
            case ALIAS -> {
                cursor.advance();
                yield BooleanFormula.alias(token.getText(), token.getSpan());
            }
            default -> throw cursor.error("Expected a proposition index, alias, 't' or 'f' but found "
                    + token.describe());
        };
    }

    @Override
    protected BooleanFormula negate(BooleanFormula operand, Span span) {
        return BooleanFormula.not(operand, span);
    }
}
