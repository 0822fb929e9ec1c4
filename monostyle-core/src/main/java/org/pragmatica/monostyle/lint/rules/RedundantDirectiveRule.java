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
 * MONO-ORD-02: Duplicate directives and directives naming the enclosing namespace.
 *
 * <p>Removal happens through the MONO-ORD-01 block rewrite.
 */
public class RedundantDirectiveRule implements StyleRule {

    private static final String RULE_ID = "MONO-ORD-02";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.ORDERING;
    }

    @Override
    public String description() {
        return "No duplicate or already-covered directives";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT, NodeKind.NAMESPACE);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        return Directives.block(node, ctx.config())
                         .stream()
                         .flatMap(block -> block.redundant()
                                                .stream())
                         .map(directive -> ctx.diagnostic(RULE_ID,
                                                          DiagnosticSeverity.WARNING,
                                                          category(),
                                                          directive.node()
                                                                   .start(),
                                                          directive.node()
                                                                   .end(),
                                                          "Redundant directive '" + directive.node()
                                                                                             .text() + "'"));
    }
}
