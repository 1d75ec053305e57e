package com.solv.core.syntax;

import com.solv.core.lexer.SolutionLexer;
import com.solv.core.lexer.SolutionToken;
import com.solv.parser.SolutionGrammar;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenFactory;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenFactory;
import org.antlr.v4.runtime.TokenSource;
import org.antlr.v4.runtime.misc.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Adapts {@link SolutionLexer} to ANTLR's {@link TokenSource}.
 *
 * <p>Marker tokens are refined by their text into the grammar's token types:
 * {@code Project(} opens a project, {@code *Section(} opens a section and
 * {@code EndProject}, {@code EndGlobal} and {@code End*Section} close them.
 */
final class SolutionTokenSource implements TokenSource {

    private static final String SECTION_SUFFIX = "Section";

    private final SolutionLexer lexer;
    private final CharStream chars;
    private final Pair<TokenSource, CharStream> origin;
    private final int[] lineStarts;
    private final int length;

    private TokenFactory<?> tokenFactory = CommonTokenFactory.DEFAULT;
    private int line = 1;
    private int column;

    SolutionTokenSource(String input, String sourceName) {
        this.lexer = new SolutionLexer(input);
        this.chars = CharStreams.fromString(input, sourceName);
        this.origin = new Pair<>(this, chars);
        this.lineStarts = lineStarts(input);
        this.length = input.length();
    }

    @Override
    public Token nextToken() {
        SolutionToken token = lexer.nextToken();
        if (token == null) {
            return create(Token.EOF, "<EOF>", length, length - 1);
        }
        return create(tokenType(token), token.text(), token.start(), token.end() - 1);
    }

    /**
     * Maps a lexer token to the grammar's token type.
     */
    static int tokenType(SolutionToken token) {
        String text = token.text();
        return switch (token.kind()) {
            case COMMENT -> SolutionGrammar.COMMENT;
            case QUOTED_STRING -> SolutionGrammar.QUOTED_STRING;
            case SECTION_KEY -> SolutionGrammar.SECTION_KEY;
            case SECTION_VALUE -> SolutionGrammar.SECTION_VALUE;
            case GUID -> SolutionGrammar.GUID;
            case NUMERIC_VERSION -> SolutionGrammar.NUMERIC_VERSION;
            case COMMA -> SolutionGrammar.COMMA;
            case EQUALS -> SolutionGrammar.EQUALS;
            case IDENTIFIER -> "Global".equals(text) ? SolutionGrammar.GLOBAL : SolutionGrammar.IDENTIFIER;
            case SECTION_OPEN_MARKER -> {
                if (text.endsWith(SECTION_SUFFIX)) {
                    yield SolutionGrammar.SECTION_OPEN;
                }
                yield "Project".equals(text) ? SolutionGrammar.PROJECT_OPEN : SolutionGrammar.INVALID;
            }
            case SECTION_CLOSE_MARKER -> {
                if ("EndProject".equals(text)) {
                    yield SolutionGrammar.END_PROJECT;
                }
                if ("EndGlobal".equals(text)) {
                    yield SolutionGrammar.END_GLOBAL;
                }
                yield text.endsWith(SECTION_SUFFIX) ? SolutionGrammar.END_SECTION : SolutionGrammar.INVALID;
            }
            case INVALID -> SolutionGrammar.INVALID;
        };
    }

    private Token create(int type, String text, int start, int stop) {
        moveTo(start);
        return tokenFactory.create(origin, type, text, Token.DEFAULT_CHANNEL, start, stop, line, column);
    }

    private void moveTo(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        line = lineIndex + 1;
        column = offset - lineStarts[lineIndex];
    }

    private static int[] lineStarts(String input) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public int getCharPositionInLine() {
        return column;
    }

    @Override
    public CharStream getInputStream() {
        return chars;
    }

    @Override
    public String getSourceName() {
        return chars.getSourceName();
    }

    @Override
    public void setTokenFactory(TokenFactory<?> factory) {
        this.tokenFactory = factory;
    }

    @Override
    public TokenFactory<?> getTokenFactory() {
        return tokenFactory;
    }
}
