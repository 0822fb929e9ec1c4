package org.pragmatica.monostyle.token;

/// Classification of significant tokens.
///
/// Punctuation is split finely enough that spacing rules can tell a call `f (x)` from a generic
/// instantiation `List<int> ()` and from an indexer `a [0]`.
public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,
    CHAR,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_BRACE,
    CLOSE_BRACE,
    GENERIC_OPEN,
    GENERIC_CLOSE,
    COMMA,
    SEMICOLON,
    DOT,
    COLON,
    QUESTION,
    ARROW,
    ASSIGNMENT,
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    ERROR,
    END_OF_FILE;

    public boolean isOpening() {
        return this == OPEN_PAREN || this == OPEN_BRACKET || this == OPEN_BRACE || this == GENERIC_OPEN;
    }

    public boolean isClosing() {
        return this == CLOSE_PAREN || this == CLOSE_BRACKET || this == CLOSE_BRACE || this == GENERIC_CLOSE;
    }

    public boolean isLiteral() {
        return this == NUMBER || this == STRING || this == CHAR;
    }
}
