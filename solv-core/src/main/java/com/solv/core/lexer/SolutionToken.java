package com.solv.core.lexer;

import java.util.Objects;

/**
 * Token produced by {@link SolutionLexer}.
 *
 * <p>{@code text} is the meaningful part of the token: quotes are not part of a
 * {@link TokenKind#QUOTED_STRING}, and section keys and values are trimmed. {@code start}
 * and {@code end} delimit that text in the source.
 *
 * @param kind token kind
 * @param text token text
 * @param start offset of the first character
 * @param end offset just past the last character
 */
public record SolutionToken(TokenKind kind, String text, int start, int end) {

    public SolutionToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
