package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-SPC-01: Exactly one space before the parenthesis of a call or of a declared parameter list.
 *
 * <pre>
 * Console.WriteLine ("x");
 * void Method (int a)
 * </pre>
 */
public class CallSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-01";

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
        return "One space before call and parameter list parentheses";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.CALL, NodeKind.METHOD, NodeKind.CONSTRUCTOR);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        int paren = node.is(NodeKind.CALL)
                    ? node.delimiter()
                    : node.firstChild(NodeKind.PARAMETER_LIST)
                          .map(SyntaxNode::firstToken)
                          .orElse(-1);
        if (paren <= 0 || !ctx.tokens()
                              .get(paren)
                              .is(TokenKind.OPEN_PAREN)) {
            return Stream.empty();
        }
        return Gaps.expectInline(ctx,
                                 RULE_ID,
                                 category(),
                                 paren - 1,
                                 " ",
                                 "Expected one space before '('")
                   .stream();
    }
}
