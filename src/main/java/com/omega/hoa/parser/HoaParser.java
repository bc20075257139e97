package com.omega.hoa.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.Header;
import com.omega.hoa.model.RawAutomaton;
import com.omega.hoa.model.RawAutomaton.Terminator;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Parser for the tokens of a single automaton, from {@code HOA:} to {@code --END--} or
 * {@code --ABORT--}. Syntax errors are recorded, never thrown.
 */
public class HoaParser {
    private static final Logger log = LoggerFactory.getLogger(HoaParser.class);

    private final TokenCursor cursor;

    public HoaParser(List<HoaToken> tokens) {
        this.cursor = new TokenCursor(tokens);
    }

    public RawAutomaton parse(Diagnostics diagnostics) {
        Span start = cursor.peek().getSpan();
        RawAutomaton.RawAutomatonBuilder raw = RawAutomaton.builder();

        if (cursor.check(Type.ABORT)) {
            HoaToken abort = cursor.advance();
            return raw.header(new Header())
                    .terminator(Terminator.ABORT)
                    .terminatorSpan(abort.getSpan())
                    .span(abort.getSpan())
                    .build();
        }

        Header header = new HeaderParser(cursor).parse(diagnostics);
        raw.header(header).headerSeen(true);

        if (!cursor.check(Type.BODY) && !cursor.check(Type.ABORT)) {
            diagnostics.report(cursor.error("Expected '--BODY--' but found " + cursor.peek().describe())
                    .getDiagnostic());
            cursor.skipUntil(t -> t.is(Type.BODY) || t.is(Type.END) || t.is(Type.ABORT));
        }
        if (cursor.match(Type.BODY)) {
            raw.bodySeen(true);
            raw.states(new BodyParser(cursor).parse(diagnostics));
        }

        HoaToken last = cursor.peek();
        if (last.is(Type.END) || last.is(Type.ABORT)) {
            cursor.advance();
            raw.terminator(last.is(Type.END) ? Terminator.END : Terminator.ABORT);
        } else {
            diagnostics.error(DiagnosticKind.SYNTAX_ERROR, last.getSpan(),
                    "Automaton is not terminated by '--END--' or '--ABORT--'");
            raw.terminator(Terminator.MISSING);
        }
        raw.terminatorSpan(last.getSpan());

        RawAutomaton automaton = raw.span(start.to(last.getSpan())).build();
        log.debug("Parsed automaton '{}' with {} state line(s), terminated by {}",
                header.getName(), automaton.getStates().size(), automaton.getTerminator());
        return automaton;
    }
}
