package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-IND-02: Wrapped parameters are indented two levels past the declaration.
 */
public class ParameterIndentRule implements StyleRule {

    private static final String RULE_ID = "MONO-IND-02";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.INDENTATION;
    }

    @Override
    public String description() {
        return "Wrapped parameters indented two levels";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.METHOD, NodeKind.CONSTRUCTOR, NodeKind.INDEXER);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        int header = node.nameToken() >= 0
                     ? node.nameToken()
                     : node.firstToken();
        var expected = ctx.indent(tokens.indentationOf(header), 2);
        return node.firstChild(NodeKind.PARAMETER_LIST)
                   .stream()
                   .flatMap(list -> list.children(NodeKind.PARAMETER)
                                        .stream())
                   .flatMap(parameter -> Gaps.reindent(tokens, parameter.firstToken(), expected)
                                             .map(edit -> ctx.diagnostic(RULE_ID,
                                                                         DiagnosticSeverity.WARNING,
                                                                         category(),
                                                                         parameter.start(),
                                                                         parameter.end(),
                                                                         "Wrapped parameter should be indented two levels past the declaration")
                                                             .withFix(Fix.fix(edit)))
                                             .stream());
    }
}
