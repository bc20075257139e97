package com.omega.hoa.diagnostics;

import java.util.List;
import java.util.Locale;

import com.omega.hoa.model.Span;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A single positioned report produced by any stage of the pipeline.
 */
@Value
@Builder
public class Diagnostic {
    Severity severity;
    DiagnosticKind kind;
    String message;
    @Singular
    List<Span> spans;
    /** Optional remediation hint, may be null. */
    String hint;

    public static Diagnostic error(DiagnosticKind kind, Span span, String message) {
        return of(Severity.ERROR, kind, span, message);
    }

    public static Diagnostic warning(DiagnosticKind kind, Span span, String message) {
        return of(Severity.WARNING, kind, span, message);
    }

    private static Diagnostic of(Severity severity, DiagnosticKind kind, Span span, String message) {
        DiagnosticBuilder builder = Diagnostic.builder()
                .severity(severity)
                .kind(kind)
                .message(message);
        if (span != null) {
            builder.span(span);
        }
        return builder.build();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * The first span, or null for diagnostics without a source location.
     */
    public Span primarySpan() {
        return spans.isEmpty() ? null : spans.get(0);
    }

    public Diagnostic withHint(String hint) {
        return new Diagnostic(severity, kind, message, spans, hint);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name().toLowerCase(Locale.ROOT))
                .append('[').append(kind).append(']');
        Span span = primarySpan();
        if (span != null) {
            sb.append(" at ").append(span);
        }
        sb.append(": ").append(message);
        if (hint != null) {
            sb.append(" (hint: ").append(hint).append(')');
        }
        return sb.toString();
    }
}
