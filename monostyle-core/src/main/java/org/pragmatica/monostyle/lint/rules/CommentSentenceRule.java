package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-CMT-02: A full-line comment reads as a sentence: it starts with an upper case letter or a
 * digit and ends with punctuation.
 *
 * <p>Short labels, task markers and commented-out code are not checked.
 */
public class CommentSentenceRule implements StyleRule {

    private static final String RULE_ID = "MONO-CMT-02";
    private static final Set<String> MARKERS = Set.of("TODO", "FIXME", "HACK", "XXX", "NOTE");
    private static final int MIN_WORDS = 3;

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
        return "Comments written as sentences";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        return ctx.tokens()
                  .tokens()
                  .stream()
                  .flatMap(token -> Comments.fullLineRuns(token)
                                            .stream())
                  .flatMap(run -> check(run, ctx).stream());
    }

    private Optional<Diagnostic> check(Comments.Run run, RuleContext ctx) {
        var text = run.text();
        if (text.isEmpty() || looksLikeCode(text) || text.split("\\s+").length < MIN_WORDS) {
            return Optional.empty();
        }
        var firstWord = text.split("[\\s:]+")[0];
        if (MARKERS.contains(firstWord)) {
            return Optional.empty();
        }
        char first = text.charAt(0);
        if (!Character.isLetterOrDigit(first)) {
            return Optional.empty();
        }
        char last = text.charAt(text.length() - 1);
        boolean capitalized = Character.isUpperCase(first) || Character.isDigit(first);
        boolean terminated = last == '.' || last == '!' || last == '?' || last == ':';
        if (capitalized && terminated) {
            return Optional.empty();
        }
        return Optional.of(ctx.diagnostic(RULE_ID,
                                          DiagnosticSeverity.ADVISORY,
                                          category(),
                                          run.first()
                                             .start(),
                                          run.first()
                                             .end(),
                                          capitalized
                                          ? "Comment should end with punctuation"
                                          : "Comment should start with an upper case letter"));
    }

    private static boolean looksLikeCode(String text) {
        char last = text.charAt(text.length() - 1);
        return last == ';' || last == '{' || last == '}' || last == ')';
    }
}
