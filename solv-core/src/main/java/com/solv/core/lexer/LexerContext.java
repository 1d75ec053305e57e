package com.solv.core.lexer;

/**
 * Multi-line lexical state of {@link SolutionLexer}.
 */
enum LexerContext {
    NEUTRAL,
    SECTION_HEADER_SEEN,
    INSIDE_SECTION_BODY,
    INSIDE_QUOTED_STRING
}
