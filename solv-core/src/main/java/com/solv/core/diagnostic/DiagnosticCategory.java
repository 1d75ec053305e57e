package com.solv.core.diagnostic;

/**
 * Kind of hard failure raised while turning solution text into a syntax tree.
 */
public enum DiagnosticCategory {

    /** The lexer produced a token that no grammar production can start with. */
    INVALID_TOKEN("invalid-token"),

    /** Input ended while the grammar still expected more tokens. */
    UNEXPECTED_EOF("unexpected-eof"),

    /** A token was present but not valid at that grammar position. */
    UNRECOGNIZED_TOKEN("unrecognized-token"),

    /** Trailing input after a complete solution. */
    EXTRA_TOKEN("extra-token"),

    /** Input ended inside a string, guid or section line. */
    LEXER_PREMATURE_EOF("lexer-premature-eof"),

    /** Input is too short to be a solution file at all. */
    CONTENT_TOO_SHORT("content-too-short");

    private final String code;

    DiagnosticCategory(String code) {
        this.code = code;
    }

    /**
     * Returns the stable, kebab-case code of this category.
     *
     * @return category code such as {@code unexpected-eof}
     */
    public String code() {
        return code;
    }
}
