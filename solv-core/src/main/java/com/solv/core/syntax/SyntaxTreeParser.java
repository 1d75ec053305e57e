package com.solv.core.syntax;

import com.solv.core.diagnostic.Diagnostic;
import com.solv.core.diagnostic.DiagnosticCategory;
import com.solv.core.diagnostic.SolutionSyntaxException;
import com.solv.core.diagnostic.Span;
import com.solv.parser.SolutionGrammar;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses solution text into a {@link SyntaxNode.Root}.
 *
 * <p>Parsing stops at the first error. The failure is reported as a
 * {@link SolutionSyntaxException} whose diagnostic falls into one of four grammar categories:
 * <ul>
 *   <li>{@code unexpected-eof} - input ended early</li>
 *   <li>{@code invalid-token} - a character no lexical rule accepts</li>
 *   <li>{@code extra-token} - input continues after a complete solution</li>
 *   <li>{@code unrecognized-token} - any other misplaced token</li>
 * </ul>
 * Lexical errors surface unchanged as {@code lexer-premature-eof}.
 */
public final class SyntaxTreeParser {

    private SyntaxTreeParser() {
        // Utility class
    }

    /**
     * Parses text that has already had its byte-order mark removed.
     *
     * @param text solution text
     * @return syntax tree covering the whole input
     * @throws SolutionSyntaxException if the text is not a solution file
     */
    public static SyntaxNode.Root parse(String text) {
        return parse(text, "<solution>");
    }

    /**
     * Parses text, naming the source in ANTLR positions.
     *
     * @param text solution text
     * @param sourceName name of the source, usually the file path
     * @return syntax tree covering the whole input
     * @throws SolutionSyntaxException if the text is not a solution file
     */
    public static SyntaxNode.Root parse(String text, String sourceName) {
        SolutionGrammar parser = new SolutionGrammar(new CommonTokenStream(new SolutionTokenSource(text, sourceName)));
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        try {
            return (SyntaxNode.Root) new SyntaxTreeBuilder().visit(parser.solution());
        } catch (ParseCancellationException e) {
            throw new SolutionSyntaxException(toDiagnostic(e, parser.getVocabulary(), text.length()), e);
        }
    }

    private static Diagnostic toDiagnostic(ParseCancellationException e, Vocabulary vocabulary, int length) {
        if (!(e.getCause() instanceof RecognitionException cause) || cause.getOffendingToken() == null) {
            return new Diagnostic(DiagnosticCategory.UNRECOGNIZED_TOKEN, Span.at(0), "Unrecognized input", List.of());
        }

        Token offending = cause.getOffendingToken();
        IntervalSet expectedSet = cause.getExpectedTokens() != null ? cause.getExpectedTokens() : new IntervalSet();
        List<String> expected = new ArrayList<>();
        for (int type : expectedSet.toList()) {
            expected.add(vocabulary.getDisplayName(type));
        }

        if (offending.getType() == Token.EOF) {
            return new Diagnostic(DiagnosticCategory.UNEXPECTED_EOF, Span.at(length),
                "Unexpected end of input" + expectedSuffix(expected), expected);
        }

        Span span = new Span(offending.getStartIndex(), offending.getStopIndex() + 1);
        String text = offending.getText();

        if (offending.getType() == SolutionGrammar.INVALID) {
            return new Diagnostic(DiagnosticCategory.INVALID_TOKEN, span, "Invalid token '" + text + "'", expected);
        }
        if (expectedSet.size() == 1 && expectedSet.contains(Token.EOF)) {
            return new Diagnostic(DiagnosticCategory.EXTRA_TOKEN, span, "Extra token '" + text + "'", expected);
        }
        return new Diagnostic(DiagnosticCategory.UNRECOGNIZED_TOKEN, span,
            "Unrecognized token '" + text + "'" + expectedSuffix(expected), expected);
    }

    private static String expectedSuffix(List<String> expected) {
        return expected.isEmpty() ? "" : ", expected one of: " + String.join(", ", expected);
    }
}
