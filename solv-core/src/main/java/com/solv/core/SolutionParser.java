package com.solv.core;

import com.solv.core.diagnostic.Diagnostic;
import com.solv.core.diagnostic.SolutionSyntaxException;
import com.solv.core.model.Solution;
import com.solv.core.reducer.SolutionReducer;
import com.solv.core.syntax.SyntaxTreeParser;

/**
 * Entry point for parsing solution text.
 *
 * <p>Runs the whole pipeline on one in-memory buffer: byte-order mark removal, lexing,
 * parsing and reduction. The call is synchronous and performs no I/O.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try {
 *     Solution solution = SolutionParser.parse(text);
 *     solution.iterateProjects().forEach(p -> System.out.println(p.name()));
 * } catch (SolutionSyntaxException e) {
 *     System.err.println(DiagnosticRenderer.render("App.sln", SolutionParser.stripByteOrderMark(text), e.getDiagnostic()));
 * }
 * }</pre>
 */
public final class SolutionParser {

    /** Byte-order mark as decoded into a Java string. */
    public static final char BYTE_ORDER_MARK = '\uFEFF';

    /** Inputs shorter than this are rejected before lexing. */
    static final int MIN_CONTENT_LENGTH = 3;

    private SolutionParser() {
        // Utility class
    }

    /**
     * Parses solution text.
     *
     * @param text full file contents, optionally starting with a byte-order mark
     * @return parsed solution
     * @throws SolutionSyntaxException if the text is not a well-formed solution file
     */
    public static Solution parse(String text) {
        return parse(text, "<solution>");
    }

    /**
     * Parses solution text, naming its source.
     *
     * @param text full file contents, optionally starting with a byte-order mark
     * @param sourceName name of the source, usually the file path
     * @return parsed solution
     * @throws SolutionSyntaxException if the text is not a well-formed solution file
     */
    public static Solution parse(String text, String sourceName) {
        if (text.length() < MIN_CONTENT_LENGTH) {
            throw new SolutionSyntaxException(Diagnostic.contentTooShort(text.length()));
        }
        return SolutionReducer.reduce(SyntaxTreeParser.parse(stripByteOrderMark(text), sourceName));
    }

    /**
     * Removes a leading byte-order mark. Diagnostic offsets refer to the returned text.
     */
    public static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }
}
