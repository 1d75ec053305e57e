package com.solv.core.diagnostic;

/**
 * Renders a {@link Diagnostic} as a compiler-style text report.
 *
 * <p><b>Output:</b>
 * <pre>{@code
 * error[unrecognized-token]: Unrecognized token 'EndGlobal', expected one of: END_PROJECT, SECTION_OPEN
 *   --> MySolution.sln:7:1
 *    |
 *  7 | EndGlobal
 *    | ^^^^^^^^^
 *    = help: Incorrect solution file syntax
 * }</pre>
 */
public final class DiagnosticRenderer {

    private DiagnosticRenderer() {
        // Utility class
    }

    /**
     * Renders a diagnostic against the text it was produced from.
     *
     * @param sourceName file name shown in the location line
     * @param source text handed to the parser
     * @param diagnostic diagnostic to render
     * @return multi-line report without a trailing newline
     */
    public static String render(String sourceName, String source, Diagnostic diagnostic) {
        int offset = Math.min(diagnostic.span().start(), source.length());

        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        int lineEnd = lineStart;
        while (lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
            lineEnd++;
        }
        int line = lineNumber(source, offset);
        int column = offset - lineStart + 1;

        String lineLabel = String.valueOf(line);
        String gutter = " ".repeat(lineLabel.length() + 1);
        int carets = Math.max(1, Math.min(diagnostic.span().length(), lineEnd - offset));

        StringBuilder report = new StringBuilder();
        report.append("error[").append(diagnostic.category().code()).append("]: ")
            .append(diagnostic.message()).append('\n');
        report.append(gutter).append("--> ").append(sourceName).append(':')
            .append(line).append(':').append(column).append('\n');
        report.append(gutter).append("|\n");
        report.append(' ').append(lineLabel).append(" | ").append(source, lineStart, lineEnd).append('\n');
        report.append(gutter).append("| ").append(" ".repeat(offset - lineStart)).append("^".repeat(carets)).append('\n');
        report.append(gutter).append("= help: ").append(diagnostic.help());
        return report.toString();
    }

    /**
     * Returns the 1-based line containing an offset.
     *
     * @param source text
     * @param offset character offset
     * @return line number
     */
    public static int lineNumber(String source, int offset) {
        int line = 1;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
