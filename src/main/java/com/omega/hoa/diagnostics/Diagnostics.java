package com.omega.hoa.diagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.omega.hoa.model.Span;

import lombok.Getter;

/**
 * Diagnostics accumulated while reading one automaton.
 *
 * Pure structure only: no logging, no formatting, no IO. Identical reports are kept once,
 * and errors beyond {@code maxErrors} are counted but not stored.
 */
public class Diagnostics {
    public static final int DEFAULT_MAX_ERRORS = 100;

    private static final Comparator<Diagnostic> RANKING = Comparator
            .comparing(Diagnostic::getSeverity)
            .thenComparingInt(d -> d.primarySpan() == null ? Integer.MAX_VALUE : d.primarySpan().getStart());

    private final Set<Diagnostic> entries = new LinkedHashSet<>();
    private final int maxErrors;
    private int errorCount;
    @Getter
    private int suppressedCount;

    public Diagnostics() {
        this(DEFAULT_MAX_ERRORS);
    }

    public Diagnostics(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be >= 1. Got: " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    public void report(Diagnostic diagnostic) {
        if (entries.contains(diagnostic)) {
            return;
        }
        if (diagnostic.isError()) {
            if (errorCount >= maxErrors) {
                suppressedCount++;
                return;
            }
            errorCount++;
        }
        entries.add(diagnostic);
    }

    public void error(DiagnosticKind kind, Span span, String message) {
        report(Diagnostic.error(kind, span, message));
    }

    public void warning(DiagnosticKind kind, Span span, String message) {
        report(Diagnostic.warning(kind, span, message));
    }

    public void addAll(Diagnostics other) {
        other.entries.forEach(this::report);
        suppressedCount += other.suppressedCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * True once further errors would be dropped.
     */
    public boolean isSaturated() {
        return errorCount >= maxErrors;
    }

    public List<Diagnostic> getErrors() {
        return entries.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> getWarnings() {
        return entries.stream().filter(d -> !d.isError()).toList();
    }

    public boolean contains(DiagnosticKind kind) {
        return entries.stream().anyMatch(d -> d.getKind() == kind);
    }

    /**
     * All diagnostics, errors first, each group in source order.
     */
    public List<Diagnostic> ranked() {
        List<Diagnostic> ranked = new ArrayList<>(entries);
        ranked.sort(RANKING);
        return ranked;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : ranked()) {
            sb.append(diagnostic).append(System.lineSeparator());
        }
        if (suppressedCount > 0) {
            sb.append(suppressedCount).append(" further error(s) suppressed").append(System.lineSeparator());
        }
        return sb.toString();
    }
}
