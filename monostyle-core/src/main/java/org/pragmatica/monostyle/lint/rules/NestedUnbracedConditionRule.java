package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-06: An {@code if} whose body is another {@code if} must use braces.
 */
public class NestedUnbracedConditionRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-06";

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
        return "Nested conditionals require braces";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.IF);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var condition = node.firstChild(NodeKind.CONDITION);
        var body = Braces.unbracedBody(node)
                         .filter(child -> child.is(NodeKind.IF));
        if (condition.isEmpty() || body.isEmpty()) {
            return Stream.empty();
        }
        var keyword = node.first();
        var diagnostic = ctx.diagnostic(RULE_ID,
                                        DiagnosticSeverity.WARNING,
                                        category(),
                                        keyword.start(),
                                        keyword.end(),
                                        "Nested conditional requires braces");
        return Stream.of(Braces.wrapBody(ctx, node, condition.get(), body.get())
                               .map(diagnostic::withFix)
                               .orElse(diagnostic));
    }
}
