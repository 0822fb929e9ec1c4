package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-02: Method and constructor bodies open on a line of their own, aligned with the declaration.
 */
public class MethodBraceRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-02";

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
        return "Method brace on its own line at the declaration indent";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.METHOD, NodeKind.CONSTRUCTOR);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        int brace = node.delimiter();
        if (brace <= 0) {
            return Stream.empty();
        }
        int header = node.nameToken() >= 0
                     ? node.nameToken()
                     : node.firstToken();
        var indent = ctx.tokens()
                        .indentationOf(header);
        return Braces.expectOwnLine(ctx, RULE_ID, brace, indent, "Method body brace belongs on its own line")
                     .stream();
    }
}
