package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * MONO-CMT-03: A comment that merely restates the statement below it adds nothing.
 *
 * <p>Words of the comment are compared with the identifiers and operators on the next line. When the
 * share of comment words found in the code reaches the configured threshold the comment is reported.
 */
public class ParaphraseCommentRule implements StyleRule {

    private static final String RULE_ID = "MONO-CMT-03";
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|_");
    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9]+");
    private static final Set<String> STOPWORDS = Set.of("a", "an", "the", "to", "of", "and", "or", "in", "on", "for",
                                                        "with", "by", "is", "are", "be", "this", "that", "it", "its",
                                                        "we", "then", "from", "at", "as", "into", "our", "here", "now");
    private static final Map<String, List<String>> OPERATOR_WORDS = Map.of("++", List.of("increment", "increase"),
                                                                           "--", List.of("decrement", "decrease"),
                                                                           "=", List.of("set", "assign"),
                                                                           "+=", List.of("add", "increase"),
                                                                           "-=", List.of("subtract", "decrease"),
                                                                           "new", List.of("create", "new"),
                                                                           "return", List.of("return"),
                                                                           "throw", List.of("throw"));

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.COMMENTS;
    }

    @Override
    public String description() {
        return "No comments paraphrasing the next statement";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        var diagnostics = new ArrayList<Diagnostic>();
        for (int i = 0; i < tokens.lastIndex(); i++) {
            var runs = Comments.fullLineRuns(tokens.get(i));
            if (runs.isEmpty()) {
                continue;
            }
            var run = runs.get(runs.size() - 1);
            paraphrase(run, codeWords(tokens, i), ctx).ifPresent(diagnostics::add);
        }
        return diagnostics.stream();
    }

    private Optional<Diagnostic> paraphrase(Comments.Run run, Set<String> code, RuleContext ctx) {
        var words = commentWords(run.text());
        if (words.size() < 2) {
            return Optional.empty();
        }
        long shared = words.stream()
                           .filter(code::contains)
                           .count();
        double ratio = (double) shared / words.size();
        if (ratio < ctx.config()
                       .paraphraseThreshold()) {
            return Optional.empty();
        }
        return Optional.of(ctx.diagnostic(RULE_ID,
                                          DiagnosticSeverity.ADVISORY,
                                          category(),
                                          run.first()
                                             .start(),
                                          run.last()
                                             .end(),
                                          "Comment restates the code below it; explain why instead"));
    }

    static Set<String> commentWords(String text) {
        var words = new HashSet<String>();
        for (var word : NON_WORD.split(text)) {
            var normalized = normalize(word);
            if (!normalized.isEmpty() && !STOPWORDS.contains(normalized)) {
                words.add(normalized);
            }
        }
        return words;
    }

    /// Words of the tokens on the line starting at the given token.
    static Set<String> codeWords(TokenSequence tokens, int first) {
        var words = new HashSet<String>();
        int line = tokens.line(first);
        for (int i = first; i < tokens.lastIndex() && tokens.line(i) == line; i++) {
            var token = tokens.get(i);
            var mapped = OPERATOR_WORDS.get(token.text());
            if (mapped != null) {
                words.addAll(mapped);
            }
            if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.KEYWORD)) {
                for (var part : CAMEL_BOUNDARY.split(token.text())) {
                    var normalized = normalize(part);
                    if (!normalized.isEmpty()) {
                        words.add(normalized);
                    }
                }
            }
        }
        return words;
    }

    /// Lower case with a plural `s` removed.
    private static String normalize(String word) {
        var lower = word.toLowerCase(Locale.ROOT);
        return lower.length() > 3 && lower.endsWith("s") && !lower.endsWith("ss")
               ? lower.substring(0, lower.length() - 1)
               : lower;
    }
}
