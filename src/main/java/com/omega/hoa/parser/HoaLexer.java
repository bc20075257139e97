package com.omega.hoa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.omega.hoa.diagnostics.DiagnosticKind;
import com.omega.hoa.diagnostics.Diagnostics;
import com.omega.hoa.model.Span;
import com.omega.hoa.parser.HoaToken.Type;

/**
 * Tokenizer for HOA text.
 *
 * Tokens are produced on demand by {@link #next(Diagnostics)}; a fresh lexer over the same
 * source yields the same sequence. Unrecognized input is reported as a lex error and skipped up
 * to the next whitespace, so one bad character never stops the rest of a stream.
 */
public class HoaLexer {
    private static final Logger log = LoggerFactory.getLogger(HoaLexer.class);

    private static final Map<String, Type> KEYWORDS = Map.of(
        "t", Type.TRUE,
        "f", Type.FALSE,
        "Inf", Type.INF,
        "Fin", Type.FIN
    );

    private static final Map<String, Type> MARKERS = Map.of(
        "--BODY--", Type.BODY,
        "--END--", Type.END,
        "--ABORT--", Type.ABORT
    );

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private boolean finished;

    public HoaLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the whole source. The last token is always {@link Type#EOF}.
     */
    public List<HoaToken> tokenize(Diagnostics diagnostics) {
        List<HoaToken> tokens = new ArrayList<>();
        HoaToken token;
        do {
            token = next(diagnostics);
            tokens.add(token);
        } while (!token.is(Type.EOF));
        return tokens;
    }

    /**
     * Next token; once the input is exhausted every call returns {@link Type#EOF}.
     */
    public HoaToken next(Diagnostics diagnostics) {
        while (true) {
            skipWhitespaceAndComments(diagnostics);
            if (pos >= source.length()) {
                if (!finished) {
                    log.trace("Reached end of input at {}:{}", line, column);
                    finished = true;
                }
                return new HoaToken(Type.EOF, "", Span.of(pos, pos, line, column));
            }
            HoaToken token = nextToken(diagnostics);
            if (token != null) {
                return token;
            }
        }
    }

    private void skipWhitespaceAndComments(Diagnostics diagnostics) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advanceChar();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment(diagnostics);
            } else {
                break;
            }
        }
    }

    private void skipBlockComment(Diagnostics diagnostics) {
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        int depth = 0;
        while (pos < source.length()) {
            if (source.charAt(pos) == '/' && peekChar(1) == '*') {
                depth++;
                advanceChar();
                advanceChar();
            } else if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                depth--;
                advanceChar();
                advanceChar();
                if (depth == 0) {
                    return;
                }
            } else {
                advanceChar();
            }
        }
        diagnostics.error(DiagnosticKind.LEX_ERROR, Span.of(startPos, pos, startLine, startCol),
                "Unterminated comment");
    }

    /**
     * Returns null when the characters at the cursor were reported and skipped.
     */
    private HoaToken nextToken(Diagnostics diagnostics) {
        char c = source.charAt(pos);
        int startPos = pos;
        int startLine = line;
        int startCol = column;

        Type single = switch (c) {
            case '!' -> Type.NOT;
            case '&' -> Type.AND;
            case '|' -> Type.OR;
            case '(' -> Type.LPAREN;
            case ')' -> Type.RPAREN;
            case '[' -> Type.LBRACKET;
            case ']' -> Type.RBRACKET;
            case '{' -> Type.LBRACE;
            case '}' -> Type.RBRACE;
            default -> null;
        };
        if (single != null) {
            advanceChar();
            return new HoaToken(single, String.valueOf(c), Span.of(startPos, pos, startLine, startCol));
        }

        if (c == '"') {
            return readString(diagnostics, startPos, startLine, startCol);
        }
        if (Character.isDigit(c)) {
            return readInteger(diagnostics, startPos, startLine, startCol);
        }
        if (c == '@') {
            return readAlias(diagnostics, startPos, startLine, startCol);
        }
        if (isIdentifierStart(c)) {
            return readIdentifierOrKeyword(startPos, startLine, startCol);
        }
        if (c == '-' && peekChar(1) == '-') {
            return readMarker(diagnostics, startPos, startLine, startCol);
        }

        skipUnrecognized();
        diagnostics.error(DiagnosticKind.LEX_ERROR, Span.of(startPos, pos, startLine, startCol),
                "Unrecognized input '" + source.substring(startPos, pos) + "'");
        return null;
    }

    private HoaToken readString(Diagnostics diagnostics, int startPos, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advanceChar(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                advanceChar();
                return new HoaToken(Type.STRING, sb.toString(), Span.of(startPos, pos, startLine, startCol));
            }
            if (c == '\\' && pos + 1 < source.length()) {
                advanceChar();
                sb.append(source.charAt(pos));
                advanceChar();
            } else {
                sb.append(c);
                advanceChar();
            }
        }

        diagnostics.error(DiagnosticKind.LEX_ERROR, Span.of(startPos, pos, startLine, startCol),
                "Unterminated string");
        return null;
    }

    private HoaToken readInteger(Diagnostics diagnostics, int startPos, int startLine, int startCol) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            advanceChar();
        }
        String text = source.substring(startPos, pos);
        Span span = Span.of(startPos, pos, startLine, startCol);
        if (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            skipUnrecognized();
            diagnostics.error(DiagnosticKind.LEX_ERROR, Span.of(startPos, pos, startLine, startCol),
                    "Unrecognized input '" + source.substring(startPos, pos) + "'");
            return null;
        }
        try {
            Integer.parseInt(text);
        } catch (NumberFormatException e) {
            diagnostics.error(DiagnosticKind.LEX_ERROR, span, "Integer " + text + " is too large");
            return null;
        }
        return new HoaToken(Type.INTEGER, text, span);
    }

    private HoaToken readAlias(Diagnostics diagnostics, int startPos, int startLine, int startCol) {
        advanceChar(); // @
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advanceChar();
        }
        Span span = Span.of(startPos, pos, startLine, startCol);
        if (pos - startPos == 1) {
            diagnostics.error(DiagnosticKind.LEX_ERROR, span, "Alias name expected after '@'");
            return null;
        }
        return new HoaToken(Type.ALIAS, source.substring(startPos, pos), span);
    }

    private HoaToken readIdentifierOrKeyword(int startPos, int startLine, int startCol) {
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advanceChar();
        }
        String text = source.substring(startPos, pos);

        if (pos < source.length() && source.charAt(pos) == ':') {
            advanceChar();
            return new HoaToken(Type.HEADER, text, Span.of(startPos, pos, startLine, startCol));
        }

        Type keyword = KEYWORDS.getOrDefault(text, Type.IDENTIFIER);
        return new HoaToken(keyword, text, Span.of(startPos, pos, startLine, startCol));
    }

    private HoaToken readMarker(Diagnostics diagnostics, int startPos, int startLine, int startCol) {
        for (Map.Entry<String, Type> marker : MARKERS.entrySet()) {
            if (source.startsWith(marker.getKey(), pos)) {
                for (int i = 0; i < marker.getKey().length(); i++) {
                    advanceChar();
                }
                return new HoaToken(marker.getValue(), marker.getKey(), Span.of(startPos, pos, startLine, startCol));
            }
        }
        skipUnrecognized();
        diagnostics.error(DiagnosticKind.LEX_ERROR, Span.of(startPos, pos, startLine, startCol),
                "Unknown marker '" + source.substring(startPos, pos) + "'");
        return null;
    }

    private void skipUnrecognized() {
        do {
            advanceChar();
        } while (pos < source.length() && !Character.isWhitespace(source.charAt(pos)));
    }

    private void advanceChar() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '-';
    }
}
