package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeFlag;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-01: Namespace and type braces open on the header line.
 *
 * A generic type with {@code where} clauses is the exception: its brace goes on a line of its own,
 * aligned with the type declaration.
 */
public class TypeBraceRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-01";

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
        return "Namespace and type braces on the header line";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.NAMESPACE, NodeKind.TYPE);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        int brace = node.delimiter();
        if (brace <= 0) {
            return Stream.empty();
        }
        if (node.is(NodeKind.TYPE) && node.has(NodeFlag.GENERIC) && node.has(NodeFlag.CONSTRAINED)) {
            int header = node.nameToken() >= 0
                         ? node.nameToken()
                         : node.firstToken();
            var indent = ctx.tokens()
                            .indentationOf(header);
            return Braces.expectOwnLine(ctx,
                                        RULE_ID,
                                        brace,
                                        indent,
                                        "Brace of a constrained generic type belongs on its own line")
                         .stream();
        }
        var what = node.is(NodeKind.NAMESPACE)
                   ? "namespace"
                   : "type";
        return Braces.expectSameLine(ctx, RULE_ID, brace, "Opening brace of a " + what + " belongs on the header line")
                     .stream();
    }
}
