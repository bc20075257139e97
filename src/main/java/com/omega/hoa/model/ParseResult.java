package com.omega.hoa.model;

import java.util.List;

import com.omega.hoa.diagnostics.Diagnostic;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One item of a HOA stream: a built automaton, a rejected one with its diagnostics, or an abort.
 * Warnings may accompany any kind.
 */
@Value
@Builder
public class ParseResult {

    public enum Kind { AUTOMATON, FAILURE, ABORTED }

    Kind kind;
    Automaton automaton;
    AbortSignal abortSignal;
    @Singular
    List<Diagnostic> diagnostics;

    public static ParseResult success(Automaton automaton, List<Diagnostic> warnings) {
        return ParseResult.builder()
                .kind(Kind.AUTOMATON)
                .automaton(automaton)
                .diagnostics(warnings)
                .build();
    }

    public static ParseResult failure(List<Diagnostic> diagnostics) {
        return ParseResult.builder()
                .kind(Kind.FAILURE)
                .diagnostics(diagnostics)
                .build();
    }

    public static ParseResult aborted(AbortSignal signal, List<Diagnostic> diagnostics) {
        return ParseResult.builder()
                .kind(Kind.ABORTED)
                .abortSignal(signal)
                .diagnostics(diagnostics)
                .build();
    }

    public boolean isAutomaton() {
        return kind == Kind.AUTOMATON;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }

    public boolean isAborted() {
        return kind == Kind.ABORTED;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }
}
