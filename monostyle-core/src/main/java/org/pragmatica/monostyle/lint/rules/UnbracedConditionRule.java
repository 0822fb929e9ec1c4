package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-05: An {@code if} may omit braces only when its condition is a single clause on one line.
 */
public class UnbracedConditionRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-05";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.BRACES;
    }

    @Override
    public String description() {
        return "Unbraced if only with a single one-line condition";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.IF);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var condition = node.firstChild(NodeKind.CONDITION);
        var body = Braces.unbracedBody(node);
        if (condition.isEmpty() || body.isEmpty() || body.get()
                                                         .is(NodeKind.IF)) {
            return Stream.empty();
        }
        if (!isCompound(condition.get(), ctx) && condition.get()
                                                          .line() == ctx.tokens()
                                                                        .line(condition.get()
                                                                                       .lastToken())) {
            return Stream.empty();
        }
        var keyword = node.first();
        var diagnostic = ctx.diagnostic(RULE_ID,
                                        DiagnosticSeverity.WARNING,
                                        category(),
                                        keyword.start(),
                                        keyword.end(),
                                        "Compound or multi-line condition requires braces");
        return Stream.of(Braces.wrapBody(ctx, node, condition.get(), body.get())
                               .map(diagnostic::withFix)
                               .orElse(diagnostic));
    }

    /// True when `&&` or `||` joins clauses at the top level of the condition.
    static boolean isCompound(SyntaxNode condition, RuleContext ctx) {
        var tokens = ctx.tokens();
        int depth = 0;
        for (int i = condition.firstToken() + 1; i < condition.lastToken(); i++) {
            var token = tokens.get(i);
            if (token.kind()
                     .isOpening()) {
                depth++;
            } else if (token.kind()
                            .isClosing()) {
                depth--;
            } else if (depth == 0 && token.is(TokenKind.BINARY_OPERATOR) && (token.text()
                                                                                  .equals("&&") || token.text()
                                                                                                        .equals("||"))) {
                return true;
            }
        }
        return false;
    }
}
