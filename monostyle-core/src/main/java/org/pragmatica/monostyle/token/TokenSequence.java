package org.pragmatica.monostyle.token;

import org.pragmatica.monostyle.shared.LineMap;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;

/// Indexed, immutable token stream of one file. The last token is always {@link TokenKind#END_OF_FILE}.
///
/// Delimiters are paired once on construction: a closing parenthesis, bracket or angle never pairs
/// across an unclosed opening brace, while a closing brace discards whatever is still open above
/// its partner.
public final class TokenSequence {
    private final String text;
    private final List<Token> tokens;
    private final LineMap lineMap;
    private final int[] matching;

    private TokenSequence(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = List.copyOf(tokens);
        this.lineMap = LineMap.lineMap(text);
        this.matching = pairDelimiters(this.tokens);
    }

    public static TokenSequence tokenSequence(String text, List<Token> tokens) {
        return new TokenSequence(text, tokens);
    }

    public String text() {
        return text;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public LineMap lineMap() {
        return lineMap;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public int lastIndex() {
        return tokens.size() - 1;
    }

    /// Index of the partner delimiter, or -1 when the token is unpaired or not a delimiter.
    public int matching(int index) {
        return matching[index];
    }

    /// Reassemble the original text from tokens and trivia.
    public String detokenize() {
        var sb = new StringBuilder(text.length());
        tokens.forEach(token -> sb.append(token.fullText()));
        return sb.toString();
    }

    /// Start of the whitespace/comment gap following the token.
    public int gapStart(int index) {
        return tokens.get(index)
                     .end();
    }

    /// End of the gap following the token, which is the start of the next token.
    public int gapEnd(int index) {
        return tokens.get(index + 1)
                     .start();
    }

    public String gapText(int index) {
        return text.substring(gapStart(index), gapEnd(index));
    }

    public boolean gapHasNewline(int index) {
        var gap = gapText(index);
        return gap.indexOf('\n') >= 0 || gap.indexOf('\r') >= 0;
    }

    /// True when the gap after the token contains a comment or a preprocessor line.
    public boolean gapHasNonWhitespace(int index) {
        return hasNonWhitespace(tokens.get(index)
                                      .trailing()) || hasNonWhitespace(tokens.get(index + 1)
                                                                             .leading());
    }

    private static boolean hasNonWhitespace(List<Trivia> trivia) {
        return trivia.stream()
                     .anyMatch(t -> t.isComment() || t.kind() == Trivia.Kind.PREPROCESSOR);
    }

    /// 1-based line of the token start.
    public int line(int index) {
        return lineMap.line(tokens.get(index)
                                  .start());
    }

    /// True when only whitespace precedes the token on its line.
    public boolean isFirstOnLine(int index) {
        var start = tokens.get(index)
                          .start();
        var lineStart = lineMap.lineStart(lineMap.line(start));
        for (int i = lineStart; i < start; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    /// Leading whitespace of the line the token starts on.
    public String indentationOf(int index) {
        return lineMap.indentation(line(index));
    }

    /// Offset where the indentation run before a line-leading token begins.
    public int indentationStart(int index) {
        return lineMap.lineStart(line(index));
    }

    private static int[] pairDelimiters(List<Token> tokens) {
        var result = new int[tokens.size()];
        Arrays.fill(result, -1);
        var open = new ArrayDeque<Integer>();
        for (int i = 0; i < tokens.size(); i++) {
            var kind = tokens.get(i)
                             .kind();
            if (kind.isOpening()) {
                open.push(i);
            } else if (kind.isClosing()) {
                pairClosing(tokens, open, result, i, openerFor(kind));
            }
        }
        return result;
    }

    private static void pairClosing(List<Token> tokens, ArrayDeque<Integer> open, int[] result, int closer, TokenKind opener) {
        int depth = 0;
        for (var candidate : open) {
            var kind = tokens.get(candidate)
                             .kind();
            if (kind == opener) {
                for (int i = 0; i <= depth; i++) {
                    open.pop();
                }
                result[candidate] = closer;
                result[closer] = candidate;
                return;
            }
            if (kind == TokenKind.OPEN_BRACE) {
                return;
            }
            depth++;
        }
    }

    private static TokenKind openerFor(TokenKind closing) {
        return switch (closing) {
            case CLOSE_PAREN -> TokenKind.OPEN_PAREN;
            case CLOSE_BRACKET -> TokenKind.OPEN_BRACKET;
            case CLOSE_BRACE -> TokenKind.OPEN_BRACE;
            default -> TokenKind.GENERIC_OPEN;
        };
    }
}
