package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-SPC-08: No space before a semicolon.
 */
public class SemicolonSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-08";

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
        return "No space before ';'";
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
                       .is(TokenKind.SEMICOLON)) {
                continue;
            }
            var previous = tokens.get(i - 1);
            // for (;;) headers keep their own layout
            if (previous.is(TokenKind.SEMICOLON) || previous.is(TokenKind.OPEN_PAREN)) {
                continue;
            }
            Gaps.expectInline(ctx, RULE_ID, category(), i - 1, "", "Unexpected space before ';'")
                .ifPresent(diagnostics::add);
        }
        return diagnostics.stream();
    }
}
