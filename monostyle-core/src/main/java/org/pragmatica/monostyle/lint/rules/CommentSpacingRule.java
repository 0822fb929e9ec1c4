package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.Trivia;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-CMT-01: Exactly one space follows the opening {@code //}, {@code ///} or {@code /*}.
 *
 * <p>Empty comments, separator lines made of slashes and block comments whose text starts on the next
 * line are left alone. Documentation comments may indent further for code samples.
 */
public class CommentSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-CMT-01";

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
        return "One space after the comment marker";
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
                  .flatMap(token -> Stream.concat(token.leading()
                                                       .stream(),
                                                  token.trailing()
                                                       .stream()))
                  .filter(Trivia::isComment)
                  .flatMap(comment -> check(comment, ctx).stream());
    }

    private Optional<Diagnostic> check(Trivia comment, RuleContext ctx) {
        var text = comment.text();
        int marker = Comments.markerLength(comment);
        var rest = text.substring(marker);
        if (comment.kind() == Trivia.Kind.BLOCK_COMMENT) {
            rest = rest.endsWith("*/")
                   ? rest.substring(0, rest.length() - 2)
                   : rest;
            if (rest.startsWith("*") || rest.startsWith("\n") || rest.startsWith("\r")) {
                return Optional.empty();
            }
        }
        if (rest.isBlank() || (comment.kind() == Trivia.Kind.LINE_COMMENT && rest.startsWith("/"))) {
            return Optional.empty();
        }
        int spaces = 0;
        while (spaces < rest.length() && (rest.charAt(spaces) == ' ' || rest.charAt(spaces) == '\t')) {
            spaces++;
        }
        var leading = rest.substring(0, spaces);
        if (leading.equals(" ")) {
            return Optional.empty();
        }
        if (comment.kind() == Trivia.Kind.DOC_COMMENT && leading.length() > 1 && leading.chars()
                                                                                        .allMatch(c -> c == ' ')) {
            return Optional.empty();
        }
        int start = comment.start() + marker;
        int end = start + spaces;
        return Optional.of(ctx.diagnostic(RULE_ID,
                                          DiagnosticSeverity.WARNING,
                                          category(),
                                          comment.start(),
                                          comment.end(),
                                          "Comment marker should be followed by exactly one space")
                              .withFix(Fix.fix(Edit.edit(start, end, " "))));
    }
}
