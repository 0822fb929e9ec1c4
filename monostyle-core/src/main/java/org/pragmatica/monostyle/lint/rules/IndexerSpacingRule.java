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
 * MONO-SPC-02: Exactly one space before the bracket of an element access or an indexer declaration.
 */
public class IndexerSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-02";

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
        return "One space before indexer brackets";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.INDEX, NodeKind.INDEXER);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        int bracket = node.is(NodeKind.INDEX)
                      ? node.delimiter()
                      : node.firstChild(NodeKind.PARAMETER_LIST)
                            .map(SyntaxNode::firstToken)
                            .orElse(-1);
        if (bracket <= 0 || !ctx.tokens()
                                .get(bracket)
                                .is(TokenKind.OPEN_BRACKET)) {
            return Stream.empty();
        }
        return Gaps.expectInline(ctx, RULE_ID, category(), bracket - 1, " ", "Expected one space before '['")
                   .stream();
    }
}
