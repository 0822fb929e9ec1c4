package org.pragmatica.monostyle.token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/// Lossless C# tokenizer.
///
/// Iterating a tokenizer scans the text lazily in a single pass; every call to {@link #iterator()}
/// starts a fresh scan. The scanner never fails: unterminated strings, characters and block
/// comments become one {@link TokenKind#ERROR} token covering the rest of the input, and
/// unknown characters become single-character error tokens.
public final class Tokenizer implements Iterable<Token> {
    private static final int GENERIC_LOOKAHEAD_LIMIT = 256;

    static final Set<String> KEYWORDS = Set.of("abstract", "as", "base", "bool", "break", "byte", "case", "catch",
                                               "char", "checked", "class", "const", "continue", "decimal", "default",
                                               "delegate", "do", "double", "else", "enum", "event", "explicit",
                                               "extern", "false", "finally", "fixed", "float", "for", "foreach",
                                               "goto", "if", "implicit", "in", "int", "interface", "internal", "is",
                                               "lock", "long", "namespace", "new", "null", "object", "operator",
                                               "out", "override", "params", "private", "protected", "public",
                                               "readonly", "ref", "return", "sbyte", "sealed", "short", "sizeof",
                                               "stackalloc", "static", "string", "struct", "switch", "this", "throw",
                                               "true", "try", "typeof", "uint", "ulong", "unchecked", "unsafe",
                                               "ushort", "using", "virtual", "void", "volatile", "while");

    private final String text;

    private Tokenizer(String text) {
        this.text = text;
    }

    /// Lazy, restartable token sequence over the text.
    public static Tokenizer tokenizer(String text) {
        return new Tokenizer(text);
    }

    /// Scan the whole text eagerly.
    public static TokenSequence tokenize(String text) {
        var tokens = new ArrayList<Token>();
        tokenizer(text).forEach(tokens::add);
        return TokenSequence.tokenSequence(text, tokens);
    }

    /// Reserved words; contextual keywords are not included.
    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner(text);
    }

    private static final class Scanner implements Iterator<Token> {
        private final String text;
        private final Set<Integer> genericCloses = new HashSet<>();
        private int pos;
        private TokenKind previous;
        private boolean finished;

        private Scanner(String text) {
            this.text = text;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException();
            }
            var leading = scanTrivia(true);
            if (pos >= text.length()) {
                finished = true;
                return Token.token(TokenKind.END_OF_FILE, "", pos, leading, List.of());
            }
            int start = pos;
            var kind = scanToken();
            var tokenText = text.substring(start, pos);
            var trailing = kind == TokenKind.ERROR && pos >= text.length()
                           ? List.<Trivia>of()
                           : scanTrivia(false);
            previous = kind;
            return Token.token(kind, tokenText, start, leading, trailing);
        }

        private List<Trivia> scanTrivia(boolean leading) {
            var trivia = new ArrayList<Trivia>();
            while (pos < text.length()) {
                int start = pos;
                char c = text.charAt(pos);
                if (c == '\r' || c == '\n') {
                    pos += c == '\r' && peek(1) == '\n'
                           ? 2
                           : 1;
                    trivia.add(Trivia.trivia(Trivia.Kind.NEWLINE, text.substring(start, pos), start));
                    if (!leading) {
                        break;
                    }
                } else if (isWhitespace(c)) {
                    while (pos < text.length() && isWhitespace(text.charAt(pos))) {
                        pos++;
                    }
                    trivia.add(Trivia.trivia(Trivia.Kind.WHITESPACE, text.substring(start, pos), start));
                } else if (c == '/' && peek(1) == '/') {
                    var kind = peek(2) == '/' && peek(3) != '/'
                               ? Trivia.Kind.DOC_COMMENT
                               : Trivia.Kind.LINE_COMMENT;
                    skipToLineEnd();
                    trivia.add(Trivia.trivia(kind, text.substring(start, pos), start));
                } else if (c == '/' && peek(1) == '*') {
                    int close = text.indexOf("*/", pos + 2);
                    if (close < 0) {
                        break;
                    }
                    var comment = text.substring(start, close + 2);
                    if (!leading && (comment.indexOf('\n') >= 0 || comment.indexOf('\r') >= 0)) {
                        break;
                    }
                    pos = close + 2;
                    trivia.add(Trivia.trivia(Trivia.Kind.BLOCK_COMMENT, comment, start));
                } else if (c == '#' && leading && onlyWhitespaceBefore(pos)) {
                    skipToLineEnd();
                    trivia.add(Trivia.trivia(Trivia.Kind.PREPROCESSOR, text.substring(start, pos), start));
                } else {
                    break;
                }
            }
            return trivia;
        }

        private TokenKind scanToken() {
            char c = text.charAt(pos);
            if (c == '/' && peek(1) == '*') {
                return remainderAsError();
            }
            if (c == '@' && peek(1) == '"') {
                pos++;
                return scanVerbatimString();
            }
            if ((c == '$' && peek(1) == '@' && peek(2) == '"') || (c == '@' && peek(1) == '$' && peek(2) == '"')) {
                pos += 2;
                return scanVerbatimString();
            }
            if (c == '$' && peek(1) == '"') {
                pos++;
                return scanInterpolatedString();
            }
            if (c == '"') {
                return peek(1) == '"' && peek(2) == '"'
                       ? scanRawString()
                       : scanRegularString();
            }
            if (c == '\'') {
                return scanChar();
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                return scanNumber();
            }
            if (isIdentifierStart(c) || (c == '@' && isIdentifierStart(peek(1)))) {
                return scanWord();
            }
            return scanPunctuation(c);
        }

        private TokenKind scanWord() {
            int start = pos;
            boolean verbatim = text.charAt(pos) == '@';
            pos++;
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return !verbatim && KEYWORDS.contains(text.substring(start, pos))
                   ? TokenKind.KEYWORD
                   : TokenKind.IDENTIFIER;
        }

        private TokenKind scanNumber() {
            if (text.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X' || peek(1) == 'b' || peek(1) == 'B')) {
                pos += 2;
                while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                    pos++;
                }
                return TokenKind.NUMBER;
            }
            skipDigits();
            if (pos < text.length() && text.charAt(pos) == '.' && Character.isDigit(peek(1))) {
                pos++;
                skipDigits();
            }
            if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
            while (pos < text.length() && "fFdDmMuUlL".indexOf(text.charAt(pos)) >= 0) {
                pos++;
            }
            return TokenKind.NUMBER;
        }

        private void skipDigits() {
            while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
        }

        private TokenKind scanRegularString() {
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                } else if (c == '"') {
                    pos++;
                    return TokenKind.STRING;
                } else if (c == '\n' || c == '\r') {
                    return remainderAsError();
                } else {
                    pos++;
                }
            }
            return remainderAsError();
        }

        private TokenKind scanVerbatimString() {
            pos++;
            while (pos < text.length()) {
                if (text.charAt(pos) == '"') {
                    if (peek(1) == '"') {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return TokenKind.STRING;
                }
                pos++;
            }
            return remainderAsError();
        }

        private TokenKind scanRawString() {
            int close = text.indexOf("\"\"\"", pos + 3);
            if (close < 0) {
                return remainderAsError();
            }
            pos = close + 3;
            while (pos < text.length() && text.charAt(pos) == '"') {
                pos++;
            }
            return TokenKind.STRING;
        }

        private TokenKind scanInterpolatedString() {
            pos++;
            int holeDepth = 0;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (holeDepth == 0) {
                    if (c == '\\') {
                        pos += 2;
                        continue;
                    }
                    if (c == '"') {
                        pos++;
                        return TokenKind.STRING;
                    }
                    if (c == '\n' || c == '\r') {
                        return remainderAsError();
                    }
                    if (c == '{') {
                        if (peek(1) == '{') {
                            pos += 2;
                            continue;
                        }
                        holeDepth++;
                    }
                    pos++;
                } else if (c == '"') {
                    if (scanRegularString() == TokenKind.ERROR) {
                        return TokenKind.ERROR;
                    }
                } else {
                    if (c == '{') {
                        holeDepth++;
                    } else if (c == '}') {
                        holeDepth--;
                    }
                    pos++;
                }
            }
            return remainderAsError();
        }

        private TokenKind scanChar() {
            int limit = Math.min(text.length(), pos + 10);
            int i = pos + 1;
            while (i < limit) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == '\'') {
                    pos = i + 1;
                    return TokenKind.CHAR;
                } else if (c == '\n' || c == '\r') {
                    break;
                } else {
                    i++;
                }
            }
            return remainderAsError();
        }

        private TokenKind remainderAsError() {
            pos = text.length();
            return TokenKind.ERROR;
        }

        private TokenKind scanPunctuation(char c) {
            char next = peek(1);
            pos++;
            switch (c) {
                case '(':
                    return TokenKind.OPEN_PAREN;
                case ')':
                    return TokenKind.CLOSE_PAREN;
                case '[':
                    return TokenKind.OPEN_BRACKET;
                case ']':
                    return TokenKind.CLOSE_BRACKET;
                case '{':
                    return TokenKind.OPEN_BRACE;
                case '}':
                    return TokenKind.CLOSE_BRACE;
                case ',':
                    return TokenKind.COMMA;
                case ';':
                    return TokenKind.SEMICOLON;
                case '.':
                    return TokenKind.DOT;
                case '~':
                    return TokenKind.UNARY_OPERATOR;
                case ':':
                    return consumeIf(':', TokenKind.DOT, TokenKind.COLON);
                case '=':
                    if (next == '>') {
                        pos++;
                        return TokenKind.ARROW;
                    }
                    return consumeIf('=', TokenKind.BINARY_OPERATOR, TokenKind.ASSIGNMENT);
                case '!':
                    return consumeIf('=', TokenKind.BINARY_OPERATOR, TokenKind.UNARY_OPERATOR);
                case '+':
                case '-':
                    if (next == c) {
                        pos++;
                        return TokenKind.UNARY_OPERATOR;
                    }
                    if (c == '-' && next == '>') {
                        pos++;
                        return TokenKind.DOT;
                    }
                    return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
                case '*':
                case '/':
                case '%':
                case '^':
                    return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
                case '&':
                case '|':
                    if (next == c) {
                        pos++;
                        return TokenKind.BINARY_OPERATOR;
                    }
                    return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
                case '?':
                    if (next == '?') {
                        pos++;
                        return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
                    }
                    return TokenKind.QUESTION;
                case '<':
                    return scanLess();
                case '>':
                    return scanGreater();
                default:
                    return TokenKind.ERROR;
            }
        }

        private TokenKind scanLess() {
            int ltPos = pos - 1;
            if (previous == TokenKind.IDENTIFIER) {
                int close = findGenericClose(ltPos);
                if (close > 0) {
                    genericCloses.add(close);
                    return TokenKind.GENERIC_OPEN;
                }
            }
            if (peek(0) == '<') {
                pos++;
                return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
            }
            return consumeIf('=', TokenKind.BINARY_OPERATOR, TokenKind.BINARY_OPERATOR);
        }

        private TokenKind scanGreater() {
            int gtPos = pos - 1;
            if (genericCloses.remove(gtPos)) {
                return TokenKind.GENERIC_CLOSE;
            }
            if (peek(0) == '>' && !genericCloses.contains(pos)) {
                pos++;
                return consumeIf('=', TokenKind.ASSIGNMENT, TokenKind.BINARY_OPERATOR);
            }
            return consumeIf('=', TokenKind.BINARY_OPERATOR, TokenKind.BINARY_OPERATOR);
        }

        /// Bounded lookahead deciding whether `<` at the position opens a type argument list.
        private int findGenericClose(int ltPos) {
            int depth = 0;
            int limit = Math.min(text.length(), ltPos + GENERIC_LOOKAHEAD_LIMIT);
            for (int i = ltPos; i < limit; i++) {
                char c = text.charAt(i);
                if (c == '<') {
                    depth++;
                } else if (c == '>') {
                    depth--;
                    if (depth == 0) {
                        return isTypeFollower(i + 1)
                               ? i
                               : -1;
                    }
                } else if (!isTypeArgumentChar(c)) {
                    return -1;
                }
            }
            return -1;
        }

        private boolean isTypeFollower(int from) {
            int i = from;
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= text.length()) {
                return true;
            }
            char c = text.charAt(i);
            char after = i + 1 < text.length()
                         ? text.charAt(i + 1)
                         : '\0';
            if ("()[]{}>,;.?:".indexOf(c) >= 0) {
                return true;
            }
            if (c == '=') {
                return after != '=';
            }
            if (c == '&' || c == '|') {
                return after == c;
            }
            return isIdentifierStart(c) || c == '@';
        }

        private static boolean isTypeArgumentChar(char c) {
            return isIdentifierPart(c) || c == '.' || c == ',' || c == '?' || c == '[' || c == ']' || c == ' ' || c == '\t' || c == '\r' || c == '\n';
        }

        private TokenKind consumeIf(char expected, TokenKind matched, TokenKind otherwise) {
            if (peek(0) == expected) {
                pos++;
                return matched;
            }
            return otherwise;
        }

        private char peek(int offset) {
            int i = pos + offset;
            return i < text.length()
                   ? text.charAt(i)
                   : '\0';
        }

        private void skipToLineEnd() {
            while (pos < text.length() && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') {
                pos++;
            }
        }

        private boolean onlyWhitespaceBefore(int offset) {
            for (int i = offset - 1; i >= 0; i--) {
                char c = text.charAt(i);
                if (c == '\n' || c == '\r') {
                    return true;
                }
                if (!isWhitespace(c)) {
                    return false;
                }
            }
            return true;
        }

        private static boolean isWhitespace(char c) {
            return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\uFEFF';
        }

        private static boolean isIdentifierStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }
    }
}
