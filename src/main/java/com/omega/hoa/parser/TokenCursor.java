package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.HoaParseException;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Forward-only position in the tokens of one automaton. Always ends with {@link Type#EOF}.
 */
public class TokenCursor {

    private final List<HoaToken> tokens;
    private int pos = 0;

    public TokenCursor(List<HoaToken> tokens) {
        this.tokens = new ArrayList<>(tokens);
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(Type.EOF)) {
            Span end = this.tokens.isEmpty() ? Span.of(0, 0, 1, 1) : endOf(this.tokens.get(this.tokens.size() - 1).getSpan());
            this.tokens.add(new HoaToken(Type.EOF, "", end));
        }
    }

    public HoaToken peek() {
        return tokens.get(pos);
    }

    public HoaToken previous() {
        return tokens.get(Math.max(pos - 1, 0));
    }

    public HoaToken advance() {
        HoaToken token = tokens.get(pos);
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    public boolean isAtEnd() {
        return tokens.get(pos).is(Type.EOF);
    }

    public boolean check(Type type) {
        return peek().is(type);
    }

    public boolean checkHeader(String keyword) {
        return peek().isHeader(keyword);
    }

    public boolean match(Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes a token of the given type or throws a syntax error naming {@code what}.
     */
    public HoaToken expect(Type type, String what) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + what + " but found " + peek().describe());
    }

    public HoaParseException error(String message) {
        return error(peek().getSpan(), message);
    }

    public HoaParseException error(Span span, String message) {
        return new HoaParseException(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, span, message));
    }

    /**
     * Skips tokens until {@code stop} holds for the current one or the input ends.
     */
    public void skipUntil(Predicate<HoaToken> stop) {
        while (!isAtEnd() && !stop.test(peek())) {
            pos++;
        }
    }

    private static Span endOf(Span span) {
        return Span.of(span.getEnd(), span.getEnd(), span.getLine(), span.getColumn() + span.length());
    }
}
