package com.solv.core.diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Positioned description of why a solution file could not be parsed.
 *
 * <p>Every diagnostic carries the same help text. Offsets in {@link #span()} index into the
 * text handed to the parser after the byte-order mark has been removed.
 *
 * @param category failure kind
 * @param span offending range in the source
 * @param message human-readable description
 * @param expected token names acceptable at the failure point, empty when unknown
 */
public record Diagnostic(
    DiagnosticCategory category,
    Span span,
    String message,
    List<String> expected
) {

    public static final String HELP = "Incorrect solution file syntax";

    public Diagnostic {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(message, "message must not be null");
        expected = expected != null ? List.copyOf(expected) : List.of();
    }

    public String help() {
        return HELP;
    }

    public static Diagnostic prematureEndOfStream(int offset) {
        return new Diagnostic(DiagnosticCategory.LEXER_PREMATURE_EOF, Span.at(offset),
            "Premature end of stream", List.of());
    }

    public static Diagnostic contentTooShort(int length) {
        return new Diagnostic(DiagnosticCategory.CONTENT_TOO_SHORT, Span.at(0),
            "Content too short (" + length + " characters) to be a solution file", List.of());
    }
}
