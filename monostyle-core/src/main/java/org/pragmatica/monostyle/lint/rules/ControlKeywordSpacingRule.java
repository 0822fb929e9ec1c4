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
 * MONO-SPC-07: One space between a control keyword and its parenthesis, as in {@code if (x)}.
 */
public class ControlKeywordSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-07";
    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "while", "for", "foreach", "switch", "catch",
                                                               "using", "lock", "fixed");

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
        return "One space between a control keyword and '('";
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
            var token = tokens.get(i);
            boolean control = (token.is(TokenKind.KEYWORD) && CONTROL_KEYWORDS.contains(token.text())) || token.isWord("when");
            if (control && tokens.get(i + 1)
                                 .is(TokenKind.OPEN_PAREN)) {
                Gaps.expectInline(ctx,
                                  RULE_ID,
                                  category(),
                                  i,
                                  " ",
                                  "Expected one space between '" + token.text() + "' and '('")
                    .ifPresent(diagnostics::add);
            }
        }
        return diagnostics.stream();
    }
}
