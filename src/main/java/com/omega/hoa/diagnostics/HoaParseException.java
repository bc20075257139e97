package com.omega.hoa.diagnostics;

/**
 * Thrown by the recursive-descent parsers on a grammar violation. The enclosing
 * line-level loop records the carried diagnostic and resynchronizes.
 */
public class HoaParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Diagnostic diagnostic;

    public HoaParseException(Diagnostic diagnostic) {
        super(diagnostic.getMessage());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
