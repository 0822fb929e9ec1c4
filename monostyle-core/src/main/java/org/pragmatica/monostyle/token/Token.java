package org.pragmatica.monostyle.token;

import java.util.List;

/// Immutable significant token with its leading and trailing trivia.
///
/// Trailing trivia holds everything on the same line up to and including the line break;
/// leading trivia holds the rest of the text before the token.
public record Token(TokenKind kind, String text, int start, List<Trivia> leading, List<Trivia> trailing) {
    public Token {
        leading = List.copyOf(leading);
        trailing = List.copyOf(trailing);
    }

    public static Token token(TokenKind kind, String text, int start, List<Trivia> leading, List<Trivia> trailing) {
        return new Token(kind, text, start, leading, trailing);
    }

    public int end() {
        return start + text.length();
    }

    /// Offset where this token's leading trivia begins.
    public int fullStart() {
        return leading.isEmpty()
               ? start
               : leading.get(0)
                        .start();
    }

    /// Offset where this token's trailing trivia ends.
    public int fullEnd() {
        return trailing.isEmpty()
               ? end()
               : trailing.get(trailing.size() - 1)
                         .end();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean is(TokenKind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }

    /// Identifier or contextual keyword with the given text.
    public boolean isWord(String word) {
        return (kind == TokenKind.IDENTIFIER || kind == TokenKind.KEYWORD) && text.equals(word);
    }

    public String fullText() {
        var sb = new StringBuilder();
        leading.forEach(t -> sb.append(t.text()));
        sb.append(text);
        trailing.forEach(t -> sb.append(t.text()));
        return sb.toString();
    }
}
