package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.HoaParseException;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.RawEdge;
import com.omega.hoa.model.RawState;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Parser for the body of one automaton, after {@code --BODY--} and up to its end marker.
 *
 * Accepts every syntactically valid state and edge line; labeling mode, universal branching
 * and index ranges are left to the validator.
 */
public class BodyParser {
    private static final Logger log = LoggerFactory.getLogger(BodyParser.class);

    private final TokenCursor cursor;

    public BodyParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public List<RawState> parse(Diagnostics diagnostics) {
        List<RawState> states = new ArrayList<>();

        while (!isBodyEnd(cursor.peek())) {
            try {
                if (!cursor.checkHeader("State")) {
                    throw cursor.error("Expected 'State:' but found " + cursor.peek().describe());
                }
                RawState state = parseStateLine();
                states.add(state);
                while (!cursor.checkHeader("State") && !isBodyEnd(cursor.peek())) {
                    state.addEdge(parseEdge());
                }
                state.setSpan(state.getSpan().to(cursor.previous().getSpan()));
                log.debug("Parsed state {} with {} edge(s)", state.getId(), state.getEdges().size());
            } catch (HoaParseException e) {
                diagnostics.report(e.getDiagnostic());
                skipToNextState();
            }
        }

        return states;
    }

    private RawState parseStateLine() {
        HoaToken keyword = cursor.advance();
        BooleanFormula label = parseOptionalLabel();
        HoaToken id = cursor.expect(Type.INTEGER, "a state id");
        String name = cursor.check(Type.STRING) ? cursor.advance().getText() : null;

        RawState.RawStateBuilder builder = RawState.builder()
                .id(id.intValue())
                .idSpan(id.getSpan())
                .name(name)
                .label(label)
                .span(keyword.getSpan());
        if (cursor.check(Type.LBRACE)) {
            Span open = cursor.peek().getSpan();
            builder.accMarks(parseAccSignature());
            builder.accSpan(open.to(cursor.previous().getSpan()));
        }
        return builder.build();
    }

    private RawEdge parseEdge() {
        Span start = cursor.peek().getSpan();
        BooleanFormula label = parseOptionalLabel();

        List<Integer> targets = new ArrayList<>();
        HoaToken first = cursor.expect(Type.INTEGER, label == null ? "an edge label or target state" : "a target state");
        targets.add(first.intValue());
        while (cursor.match(Type.AND)) {
            targets.add(cursor.expect(Type.INTEGER, "a target state after '&'").intValue());
        }
        Span targetSpan = first.getSpan().to(cursor.previous().getSpan());

        RawEdge.RawEdgeBuilder builder = RawEdge.builder()
                .label(label)
                .targets(List.copyOf(targets))
                .targetSpan(targetSpan);
        if (cursor.check(Type.LBRACE)) {
            Span open = cursor.peek().getSpan();
            builder.accMarks(parseAccSignature());
            builder.accSpan(open.to(cursor.previous().getSpan()));
        }
        return builder.span(start.to(cursor.previous().getSpan())).build();
    }

    private BooleanFormula parseOptionalLabel() {
        if (!cursor.match(Type.LBRACKET)) {
            return null;
        }
        BooleanFormula label = new LabelFormulaParser(cursor).parse();
        cursor.expect(Type.RBRACKET, "']' to close the label");
        return label;
    }

    private List<Integer> parseAccSignature() {
        cursor.expect(Type.LBRACE, "'{'");
        List<Integer> marks = new ArrayList<>();
        while (cursor.check(Type.INTEGER)) {
            marks.add(cursor.advance().intValue());
        }
        cursor.expect(Type.RBRACE, "'}' to close the acceptance signature");
        return List.copyOf(marks);
    }

    private void skipToNextState() {
        cursor.skipUntil(t -> t.isHeader("State") || isBodyEnd(t));
    }

    private static boolean isBodyEnd(HoaToken token) {
        return token.is(Type.END) || token.is(Type.ABORT) || token.is(Type.EOF);
    }
}
