package org.pragmatica.monostyle.token;

/// Non-significant text attached to a token, kept verbatim.
public record Trivia(Kind kind, String text, int start) {
    public enum Kind {
        WHITESPACE,
        NEWLINE,
        LINE_COMMENT,
        DOC_COMMENT,
        BLOCK_COMMENT,
        PREPROCESSOR
    }

    public static Trivia trivia(Kind kind, String text, int start) {
        return new Trivia(kind, text, start);
    }

    public int end() {
        return start + text.length();
    }

    public boolean isComment() {
        return kind == Kind.LINE_COMMENT || kind == Kind.DOC_COMMENT || kind == Kind.BLOCK_COMMENT;
    }
}
