package com.solv.core.lexer;

import com.solv.core.diagnostic.Diagnostic;
import com.solv.core.diagnostic.SolutionSyntaxException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Context-sensitive lexer for solution files.
 *
 * <p>Tokens are produced lazily, one per {@link #next()} call, with a single character of
 * lookahead. Whitespace, parentheses, closing quotes and line starts outside section bodies
 * are consumed without producing a token.
 *
 * <p>The lexer tracks whether it is inside a section body. There, a line is split into a
 * {@link TokenKind#SECTION_KEY} (everything up to {@code =}) and a
 * {@link TokenKind#SECTION_VALUE} (everything after it up to the end of the line), because
 * keys such as {@code {GUID}.Debug .NET 4.0|Any CPU.ActiveCfg} contain characters that are
 * meaningless anywhere else.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SolutionLexer lexer = new SolutionLexer(text);
 * while (lexer.hasNext()) {
 *     SolutionToken token = lexer.next();
 *     ...
 * }
 * }</pre>
 *
 * <p>Running out of input inside a quoted string, a guid or a section key raises a
 * {@link SolutionSyntaxException} with a {@code lexer-premature-eof} diagnostic.
 */
public final class SolutionLexer implements Iterator<SolutionToken> {

    private static final String SECTION_SUFFIX = "Section";
    private static final String CLOSE_PREFIX = "End";

    private final String input;
    private int position;
    private LexerContext context = LexerContext.NEUTRAL;
    private LexerContext contextBeforeString = LexerContext.NEUTRAL;
    private SolutionToken lookahead;
    private boolean exhausted;

    public SolutionLexer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    /**
     * Lexes a whole buffer.
     *
     * @param input solution text
     * @return all tokens in source order
     * @throws SolutionSyntaxException if input ends inside a string, guid or section key
     */
    public static List<SolutionToken> tokenize(String input) {
        List<SolutionToken> tokens = new ArrayList<>();
        new SolutionLexer(input).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !exhausted) {
            lookahead = scan();
            exhausted = lookahead == null;
        }
        return lookahead != null;
    }

    @Override
    public SolutionToken next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }
        SolutionToken token = lookahead;
        lookahead = null;
        return token;
    }

    /**
     * Returns the next token, or {@code null} once the input is exhausted.
     */
    public SolutionToken nextToken() {
        return hasNext() ? next() : null;
    }

    /**
     * Returns the offset just past the last consumed character.
     */
    public int position() {
        return position;
    }

    private SolutionToken scan() {
        while (position < input.length()) {
            int start = position;
            char c = input.charAt(position++);
            SolutionToken token = switch (c) {
                case ' ', '\t', '(', ')' -> null;
                case '\r', '\n' -> sectionKey();
                case '=' -> sectionValueOrEquals(start);
                case ',' -> token(TokenKind.COMMA, start, position);
                case '{' -> guid(start);
                case '"' -> quotedString(start);
                case '#' -> comment(start);
                default -> {
                    if (isDigit(c)) {
                        yield numericVersion(start);
                    }
                    if (isLetter(c)) {
                        yield identifier(start);
                    }
                    yield token(TokenKind.INVALID, start, position);
                }
            };
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    private SolutionToken sectionKey() {
        while (position < input.length() && isLineSpace(input.charAt(position))) {
            position++;
        }
        if (context == LexerContext.SECTION_HEADER_SEEN) {
            context = LexerContext.INSIDE_SECTION_BODY;
        }
        if (context != LexerContext.INSIDE_SECTION_BODY) {
            return null;
        }
        if (input.startsWith(CLOSE_PREFIX, position)) {
            context = LexerContext.NEUTRAL;
            return null;
        }
        if (position >= input.length()) {
            // Unclosed section; the grammar reports the missing close marker.
            return null;
        }

        int keyStart = position;
        while (position < input.length() && input.charAt(position) != '=') {
            position++;
        }
        if (position >= input.length()) {
            throw prematureEndOfStream(keyStart);
        }
        return token(TokenKind.SECTION_KEY, keyStart, trimEnd(keyStart, position));
    }

    private SolutionToken sectionValueOrEquals(int start) {
        if (context != LexerContext.INSIDE_SECTION_BODY) {
            return token(TokenKind.EQUALS, start, position);
        }
        while (position < input.length() && isBlank(input.charAt(position))) {
            position++;
        }
        int valueStart = position;
        while (position < input.length() && !isNewLine(input.charAt(position))) {
            position++;
        }
        return token(TokenKind.SECTION_VALUE, valueStart, trimEnd(valueStart, position));
    }

    private SolutionToken guid(int start) {
        int close = input.indexOf('}', position);
        if (close < 0) {
            throw prematureEndOfStream(start);
        }
        position = close + 1;
        return token(TokenKind.GUID, start, position);
    }

    private SolutionToken quotedString(int start) {
        if (context == LexerContext.INSIDE_QUOTED_STRING) {
            context = contextBeforeString;
            return null;
        }
        contextBeforeString = context;
        context = LexerContext.INSIDE_QUOTED_STRING;

        int contentStart = position;
        boolean containsGuid = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == '"') {
                // The closing quote is left for the next scan, which restores the context.
                return token(containsGuid ? TokenKind.GUID : TokenKind.QUOTED_STRING, contentStart, position);
            }
            if (c == '{') {
                containsGuid = true;
            }
            position++;
        }
        throw prematureEndOfStream(start);
    }

    private SolutionToken comment(int start) {
        while (position < input.length() && !isNewLine(input.charAt(position))) {
            position++;
        }
        return token(TokenKind.COMMENT, start, position);
    }

    private SolutionToken numericVersion(int start) {
        while (position < input.length() && (isDigit(input.charAt(position)) || input.charAt(position) == '.')) {
            position++;
        }
        return token(TokenKind.NUMERIC_VERSION, start, position);
    }

    private SolutionToken identifier(int start) {
        while (position < input.length() && isLetter(input.charAt(position))) {
            position++;
        }
        int end = position;
        String text = input.substring(start, end);

        if (position < input.length() && input.charAt(position) == '(') {
            position++;
            if (text.endsWith(SECTION_SUFFIX)) {
                context = LexerContext.SECTION_HEADER_SEEN;
            }
            return new SolutionToken(TokenKind.SECTION_OPEN_MARKER, text, start, end);
        }
        if (text.startsWith(CLOSE_PREFIX)) {
            context = LexerContext.NEUTRAL;
            return new SolutionToken(TokenKind.SECTION_CLOSE_MARKER, text, start, end);
        }
        return new SolutionToken(TokenKind.IDENTIFIER, text, start, end);
    }

    private SolutionToken token(TokenKind kind, int start, int end) {
        return new SolutionToken(kind, input.substring(start, end), start, end);
    }

    private int trimEnd(int start, int end) {
        while (end > start && isBlank(input.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static SolutionSyntaxException prematureEndOfStream(int offset) {
        return new SolutionSyntaxException(Diagnostic.prematureEndOfStream(offset));
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isNewLine(char c) {
        return c == '\r' || c == '\n';
    }

    private static boolean isLineSpace(char c) {
        return isBlank(c) || isNewLine(c);
    }
}
