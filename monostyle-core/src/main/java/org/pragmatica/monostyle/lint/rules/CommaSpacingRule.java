package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-SPC-05: No space before a comma and exactly one after it.
 *
 * Commas of rank specifiers ({@code int[,]}) and unbound generics ({@code Dictionary<,>}) are left alone.
 */
public class CommaSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-05";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.SPACING;
    }

    @Override
    public String description() {
        return "No space before a comma, one space after";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        var diagnostics = new ArrayList<Diagnostic>();
        for (int i = 1; i < tokens.lastIndex(); i++) {
            if (!tokens.get(i)
                       .is(TokenKind.COMMA) || isPlaceholderComma(tokens, i)) {
                continue;
            }
            Gaps.expectInline(ctx, RULE_ID, category(), i - 1, "", "Unexpected space before ','")
                .ifPresent(diagnostics::add);
            Gaps.expectInline(ctx, RULE_ID, category(), i, " ", "Expected one space after ','")
                .ifPresent(diagnostics::add);
        }
        return diagnostics.stream();
    }

    private static boolean isPlaceholderComma(TokenSequence tokens, int index) {
        var before = tokens.get(index - 1)
                           .kind();
        var after = tokens.get(index + 1)
                          .kind();
        boolean openBefore = before == TokenKind.OPEN_BRACKET || before == TokenKind.GENERIC_OPEN || before == TokenKind.COMMA;
        boolean closeAfter = after == TokenKind.CLOSE_BRACKET || after == TokenKind.GENERIC_CLOSE || after == TokenKind.COMMA;
        return openBefore && closeAfter;
    }
}
