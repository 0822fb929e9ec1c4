package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.token.Token;
import org.pragmatica.monostyle.token.Trivia;

import java.util.ArrayList;
import java.util.List;

/// Comment trivia helpers shared by the comment rules.
final class Comments {
    private Comments() {}

    /// Consecutive full-line `//` comments, not separated by blank lines or other trivia.
    record Run(List<Trivia> comments) {
        Trivia first() {
            return comments.get(0);
        }

        Trivia last() {
            return comments.get(comments.size() - 1);
        }

        String text() {
            var sb = new StringBuilder();
            for (var comment : comments) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(body(comment));
            }
            return sb.toString();
        }
    }

    /// Runs of full-line comments in the token's leading trivia.
    static List<Run> fullLineRuns(Token token) {
        var runs = new ArrayList<Run>();
        var current = new ArrayList<Trivia>();
        int newlines = 0;
        for (var trivia : token.leading()) {
            switch (trivia.kind()) {
                case LINE_COMMENT -> {
                    if (newlines > 1) {
                        flush(current, runs);
                    }
                    current.add(trivia);
                    newlines = 0;
                }
                case NEWLINE -> newlines++;
                case WHITESPACE -> {
                }
                default -> {
                    flush(current, runs);
                    newlines = 0;
                }
            }
        }
        flush(current, runs);
        return runs;
    }

    private static void flush(List<Trivia> current, List<Run> runs) {
        if (!current.isEmpty()) {
            runs.add(new Run(List.copyOf(current)));
            current.clear();
        }
    }

    /// Length of the opening marker: `//`, `///`, `/*` or `/**`.
    static int markerLength(Trivia comment) {
        var text = comment.text();
        return switch (comment.kind()) {
            case DOC_COMMENT -> 3;
            case BLOCK_COMMENT -> text.startsWith("/**") && !text.startsWith("/**/")
                                  ? 3
                                  : 2;
            default -> 2;
        };
    }

    /// Comment text without its markers, trimmed.
    static String body(Trivia comment) {
        var text = comment.text()
                          .substring(markerLength(comment));
        if (comment.kind() == Trivia.Kind.BLOCK_COMMENT && text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        return text.strip();
    }
}
