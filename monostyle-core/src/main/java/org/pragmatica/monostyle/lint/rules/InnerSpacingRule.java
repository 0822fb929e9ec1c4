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
 * MONO-SPC-03: No space just inside parentheses, brackets and generic angles.
 */
public class InnerSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-03";

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
        return "No space inside (), [] and <>";
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
            var kind = tokens.get(i)
                             .kind();
            if (kind != TokenKind.OPEN_PAREN && kind != TokenKind.OPEN_BRACKET && kind != TokenKind.GENERIC_OPEN) {
                continue;
            }
            int close = tokens.matching(i);
            if (close < 0) {
                continue;
            }
            var opening = tokens.get(i)
                                .text();
            Gaps.expectInline(ctx, RULE_ID, category(), i, "", "Unexpected space after '" + opening + "'")
                .ifPresent(diagnostics::add);
            if (close > i + 1) {
                Gaps.expectInline(ctx,
                                  RULE_ID,
                                  category(),
                                  close - 1,
                                  "",
                                  "Unexpected space before '" + tokens.get(close)
                                                                      .text() + "'")
                    .ifPresent(diagnostics::add);
            }
        }
        return diagnostics.stream();
    }
}
