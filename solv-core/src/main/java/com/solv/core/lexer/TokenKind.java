package com.solv.core.lexer;

/**
 * Kinds of tokens emitted by {@link SolutionLexer}.
 */
public enum TokenKind {
    COMMENT,
    QUOTED_STRING,
    SECTION_KEY,
    SECTION_VALUE,
    GUID,
    IDENTIFIER,
    NUMERIC_VERSION,
    /** Identifier directly followed by {@code (}, such as {@code Project(} or {@code GlobalSection(}. */
    SECTION_OPEN_MARKER,
    /** Identifier starting with {@code End}, such as {@code EndProject} or {@code EndGlobalSection}. */
    SECTION_CLOSE_MARKER,
    COMMA,
    EQUALS,
    /** Character no lexical rule accepts. */
    INVALID
}
