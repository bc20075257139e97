package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.diagnostics.HoaParseException;
import com.omega.hoa.model.AcceptanceName;
import com.omega.hoa.model.AcceptanceNameHint;
import com.omega.hoa.model.AliasDefinition;
import com.omega.hoa.model.BooleanFormula;
import com.omega.hoa.model.Header;
import com.omega.hoa.model.PropertyFlag;
import com.omega.hoa.model.Span;
import com.omega.hoa.model.StartSet;
import com.omega.hoa.model.ToolInfo;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Parser for the header of one automaton, from {@code HOA:} up to (not including) {@code --BODY--}.
 *
 * Parsing only:
 * - Fills a {@link Header} item by item
 * - Reports syntax errors and repeated items
 * - Keeps unknown items verbatim
 *
 * It does NOT check indices, counts or alias references; that is the validator's job.
 */
public class HeaderParser {
    private static final Logger log = LoggerFactory.getLogger(HeaderParser.class);

    /** Items that may occur at most once. */
    private static final Set<String> SINGLE_ITEMS = Set.of(
        "HOA", "States", "AP", "Acceptance", "acc-name", "tool", "name"
    );

    private final TokenCursor cursor;

    public HeaderParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public Header parse(Diagnostics diagnostics) {
        Header header = new Header();

        if (!cursor.checkHeader("HOA")) {
            diagnostics.report(cursor.error("Expected 'HOA:' at the start of an automaton but found "
                    + cursor.peek().describe()).getDiagnostic());
            cursor.skipUntil(t -> t.is(Type.HEADER) || isSectionEnd(t));
        }

        while (cursor.check(Type.HEADER)) {
            HoaToken item = cursor.advance();
            try {
                parseItem(item, header, diagnostics);
                expectItemEnd(item);
            } catch (HoaParseException e) {
                diagnostics.report(e.getDiagnostic());
                skipToNextItem();
            }
        }

        return header;
    }

    private void parseItem(HoaToken item, Header header, Diagnostics diagnostics) {
        String name = item.getText();
        if (header.getItemSpans().containsKey(name) && SINGLE_ITEMS.contains(name)) {
            diagnostics.error(DiagnosticKind.DUPLICATE_HEADER_ITEM, item.getSpan(),
                    "Header item '" + name + ":' may only appear once");
            skipToNextItem();
            return;
        }
        header.getItemSpans().putIfAbsent(name, item.getSpan());

        switch (name) {
            case "HOA" -> {
                header.setVersion(cursor.expect(Type.IDENTIFIER, "a format version such as v1").getText());
                if (!"v1".equals(header.getVersion())) {
                    diagnostics.warning(DiagnosticKind.UNSUPPORTED_VERSION, cursor.previous().getSpan(),
                            "Format version '" + header.getVersion() + "' is read as v1");
                }
            }
            case "States" -> header.setStateCount(cursor.expect(Type.INTEGER, "a state count").intValue());
            case "Start" -> header.getStartSets().add(parseStartSet(item));
            case "AP" -> parseAtomicPropositions(header);
            case "Alias" -> parseAlias(header);
            case "Acceptance" -> {
                header.setAcceptanceCount(cursor.expect(Type.INTEGER, "the number of acceptance sets").intValue());
                header.setAcceptanceCondition(new AcceptanceFormulaParser(cursor).parse());
            }
            case "acc-name" -> header.setAcceptanceName(parseAcceptanceName());
            case "tool" -> {
                String tool = cursor.expect(Type.STRING, "a tool name string").getText();
                String version = cursor.check(Type.STRING) ? cursor.advance().getText() : null;
                header.setTool(new ToolInfo(tool, version));
            }
            case "name" -> header.setName(cursor.expect(Type.STRING, "an automaton name string").getText());
            case "properties" -> parseProperties(header, diagnostics);
            default -> parseMiscItem(item, header, diagnostics);
        }
        log.debug("Parsed header item {}: at {}", name, item.getSpan());
    }

    private StartSet parseStartSet(HoaToken item) {
        List<Integer> states = new ArrayList<>();
        HoaToken first = cursor.expect(Type.INTEGER, "a start state");
        states.add(first.intValue());
        while (cursor.match(Type.AND)) {
            states.add(cursor.expect(Type.INTEGER, "a start state after '&'").intValue());
        }
        return new StartSet(List.copyOf(states), first.getSpan().to(cursor.previous().getSpan()));
    }

    private void parseAtomicPropositions(Header header) {
        header.setApCount(cursor.expect(Type.INTEGER, "the number of atomic propositions").intValue());
        while (cursor.check(Type.STRING)) {
            header.getApNames().add(cursor.advance().getText());
        }
    }

    private void parseAlias(Header header) {
        HoaToken name = cursor.expect(Type.ALIAS, "an alias name starting with '@'");
        BooleanFormula formula = new LabelFormulaParser(cursor).parse();
        Span span = name.getSpan().to(formula.getSpan());
        header.getAliases().add(new AliasDefinition(name.getText(), formula, header.getAliases().size(), span));
    }

    private AcceptanceNameHint parseAcceptanceName() {
        HoaToken name = cursor.expect(Type.IDENTIFIER, "an acceptance name");
        List<String> parameters = new ArrayList<>();
        while (cursor.check(Type.IDENTIFIER) || cursor.check(Type.INTEGER)
                || cursor.check(Type.TRUE) || cursor.check(Type.FALSE)) {
            parameters.add(cursor.advance().getText());
        }
        AcceptanceName known = AcceptanceName.fromHoa(name.getText()).orElse(null);
        return new AcceptanceNameHint(name.getText(), known, List.copyOf(parameters),
                name.getSpan().to(cursor.previous().getSpan()));
    }

    private void parseProperties(Header header, Diagnostics diagnostics) {
        while (isValueToken(cursor.peek())) {
            HoaToken token = cursor.advance();
            Optional<PropertyFlag> flag = PropertyFlag.fromHoa(token.getText());
            if (flag.isPresent()) {
                header.getProperties().add(flag.get());
            } else {
                header.getUnknownProperties().add(token.getText());
                diagnostics.warning(DiagnosticKind.UNKNOWN_PROPERTY, token.getSpan(),
                        "Unknown property '" + token.getText() + "' is ignored");
            }
        }
    }

    private void parseMiscItem(HoaToken item, Header header, Diagnostics diagnostics) {
        List<String> values = header.getMiscItems().computeIfAbsent(item.getText(), k -> new ArrayList<>());
        while (!cursor.check(Type.HEADER) && !isSectionEnd(cursor.peek())) {
            HoaToken value = cursor.advance();
            values.add(value.is(Type.STRING) ? quote(value.getText()) : value.getText());
        }
        diagnostics.warning(DiagnosticKind.UNKNOWN_HEADER_ITEM, item.getSpan(),
                "Unknown header item '" + item.getText() + ":' kept as metadata");
    }

    private void expectItemEnd(HoaToken item) {
        if (!cursor.check(Type.HEADER) && !isSectionEnd(cursor.peek())) {
            throw cursor.error("Unexpected " + cursor.peek().describe() + " in '" + item.getText() + ":' item");
        }
    }

    private void skipToNextItem() {
        cursor.skipUntil(t -> t.is(Type.HEADER) || isSectionEnd(t));
    }

    private static boolean isValueToken(HoaToken token) {
        return token.is(Type.IDENTIFIER) || token.is(Type.TRUE) || token.is(Type.FALSE)
                || token.is(Type.INF) || token.is(Type.FIN);
    }

    static boolean isSectionEnd(HoaToken token) {
        return token.is(Type.BODY) || token.is(Type.END) || token.is(Type.ABORT) || token.is(Type.EOF);
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
