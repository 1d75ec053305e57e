package com.solv.core.diagnostic;

import java.util.Objects;

/**
 * Thrown when solution text cannot be lexed or parsed.
 *
 * <p>Aborts parsing of one file only. The attached {@link Diagnostic} locates the failure
 * and can be rendered with {@link DiagnosticRenderer}.
 */
public class SolutionSyntaxException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    public SolutionSyntaxException(Diagnostic diagnostic) {
        super(Objects.requireNonNull(diagnostic, "diagnostic must not be null").message());
        this.diagnostic = diagnostic;
    }

    public SolutionSyntaxException(Diagnostic diagnostic, Throwable cause) {
        super(Objects.requireNonNull(diagnostic, "diagnostic must not be null").message(), cause);
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
