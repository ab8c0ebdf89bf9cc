package org.pragmatica.hoa.lexer;

/**
 * Lexical categories of the HOA format.
 */
public enum TokenKind {
    // Literals
    INT("integer", false),
    IDENTIFIER("identifier", false),
    STRING("string", false),
    HEADER_NAME("header", true),
    ALIAS_NAME("alias", false),

    // Structural markers
    BODY("--BODY--", true),
    END("--END--", true),
    ABORT("--ABORT--", true),

    // Header keywords
    HOA("HOA:", true),
    STATE("State:", true),
    STATES("States:", true),
    START("Start:", true),
    AP("AP:", true),
    ALIAS("Alias:", true),
    ACCEPTANCE("Acceptance:", true),
    ACC_NAME("acc-name:", true),
    TOOL("tool:", true),
    NAME("name:", true),
    PROPERTIES("properties:", true),

    // Punctuation
    NOT("!", false),
    AND("&", false),
    OR("|", false),
    LPAREN("(", false),
    RPAREN(")", false),
    LBRACKET("[", false),
    RBRACKET("]", false),
    LBRACE("{", false),
    RBRACE("}", false),

    // Boolean literals
    TRUE("t", false),
    FALSE("f", false),

    EOF("end of input", true);

    private final String text;
    private final boolean boundary;

    TokenKind(String text, boolean boundary) {
        this.text = text;
        this.boundary = boundary;
    }

    /**
     * Fixed source text, or a category name for tokens carrying a payload.
     */
    public String text() {
        return text;
    }

    /**
     * Whether this token ends the free-form content of a header item.
     */
    public boolean isHeaderBoundary() {
        return boundary;
    }
}
