package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-ORD-01: Using directives are grouped by tier and top-level prefix, sorted shortest first,
 * with one blank line between groups.
 *
 * <p>The fix rewrites the whole directive block, which also drops duplicate and already-covered
 * directives. Blocks holding comments or preprocessor lines are reported without a fix.
 */
public class DirectiveOrderRule implements StyleRule {

    private static final String RULE_ID = "MONO-ORD-01";

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
        return "Using directives grouped and ordered";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT, NodeKind.NAMESPACE);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        return Directives.block(node, ctx.config())
                         .stream()
                         .flatMap(block -> check(block, ctx));
    }

    private Stream<Diagnostic> check(Directives.Block block, RuleContext ctx) {
        var tokens = ctx.tokens();
        var first = block.directives()
                         .get(0)
                         .node();
        var last = block.directives()
                        .get(block.directives()
                                  .size() - 1)
                        .node();
        var expected = Directives.render(block, ctx.lineBreak(), tokens.indentationOf(first.firstToken()));
        var actual = ctx.text()
                        .substring(block.start(), block.end());
        if (expected.equals(actual)) {
            return Stream.empty();
        }
        var diagnostic = ctx.diagnostic(RULE_ID,
                                        DiagnosticSeverity.WARNING,
                                        category(),
                                        block.start(),
                                        first.end(),
                                        "Using directives should be grouped by tier and prefix, shortest name first");
        for (int i = first.firstToken(); i < last.lastToken(); i++) {
            if (tokens.gapHasNonWhitespace(i)) {
                return Stream.of(diagnostic);
            }
        }
        return Stream.of(diagnostic.withFix(Fix.fix(Edit.edit(block.start(), block.end(), expected))));
    }
}
