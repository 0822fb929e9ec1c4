package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-03: Property, indexer and accessor braces open on the same line.
 */
public class PropertyBraceRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-03";

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
        return "Property and accessor braces on the same line";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.PROPERTY, NodeKind.INDEXER, NodeKind.ACCESSOR);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        int brace = node.delimiter();
        if (brace <= 0) {
            return Stream.empty();
        }
        var what = node.is(NodeKind.ACCESSOR)
                   ? "accessor"
                   : "property";
        return Braces.expectSameLine(ctx, RULE_ID, brace, "Opening brace of a " + what + " belongs on the same line")
                     .stream();
    }
}
