package com.omega.hoa.cli.output;

import java.util.Locale;

import com.omega.hoa.diagnostics.Diagnostic;
import com.omega.hoa.model.Span;

/**
 * Renders a diagnostic with the source line it points at and a caret underline.
 */
public class DiagnosticRenderer {

    public String render(Diagnostic diagnostic, String source, String sourceName) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.getSeverity().name().toLowerCase(Locale.ROOT))
                .append('[').append(diagnostic.getKind()).append("]: ")
                .append(diagnostic.getMessage()).append('\n');

        Span span = diagnostic.primarySpan();
        if (span != null && source != null && span.getStart() <= source.length()) {
            int lineStart = source.lastIndexOf('\n', span.getStart() - 1) + 1;
            int lineEnd = source.indexOf('\n', span.getStart());
            if (lineEnd < 0) {
                lineEnd = source.length();
            }
            String line = source.substring(lineStart, lineEnd).replace("\r", "");
            String number = Integer.toString(span.getLine());
            String gutter = " ".repeat(number.length());
            int column = span.getStart() - lineStart;
            int width = Math.max(1, Math.min(span.length(), Math.max(line.length() - column, 1)));

            sb.append(gutter).append("--> ").append(sourceName).append(':').append(span).append('\n');
            sb.append(gutter).append(" |\n");
            sb.append(number).append(" | ").append(line).append('\n');
            sb.append(gutter).append(" | ").append(" ".repeat(column)).append("^".repeat(width)).append('\n');
        } else {
            sb.append(" --> ").append(sourceName).append('\n');
        }
        if (diagnostic.getHint() != null) {
            sb.append("= hint: ").append(diagnostic.getHint()).append('\n');
        }
        return sb.toString();
    }
}
