package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-NAM-01: Parameters use camel casing.
 *
 * <p>Renames are offered only for lambda, anonymous method and local function parameters, whose
 * uses are all visible in the enclosing member. Record primary constructor parameters are properties
 * and keep their casing.
 */
public class ParameterNamingRule implements StyleRule {

    private static final String RULE_ID = "MONO-NAM-01";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.NAMING;
    }

    @Override
    public String description() {
        return "Parameters in camel case";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.PARAMETER);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var name = node.name();
        var owner = node.parent()
                        .flatMap(SyntaxNode::parent);
        if (name.isEmpty() || owner.isEmpty() || owner.get()
                                                      .is(NodeKind.TYPE)) {
            return Stream.empty();
        }
        var text = name.get();
        if (Names.isExempt(text) || Names.isCamel(text)) {
            return Stream.empty();
        }
        var suggestion = Names.toCamel(text);
        var token = ctx.tokens()
                       .get(node.nameToken());
        var diagnostic = ctx.diagnostic(RULE_ID,
                                        DiagnosticSeverity.WARNING,
                                        category(),
                                        token.start(),
                                        token.end(),
                                        "Parameter '" + text + "' should be camel case: '" + suggestion + "'");
        return Stream.of(renameScope(owner.get()).flatMap(scope -> Names.localRename(scope,
                                                                                    Names.outermostMember(scope),
                                                                                    text,
                                                                                    suggestion))
                                                 .map(diagnostic::withFix)
                                                 .orElse(diagnostic));
    }

    private static Optional<SyntaxNode> renameScope(SyntaxNode owner) {
        if (owner.is(NodeKind.LAMBDA) || owner.is(NodeKind.ANONYMOUS)) {
            return Optional.of(owner);
        }
        boolean localFunction = owner.is(NodeKind.METHOD) && owner.parent()
                                                                  .filter(parent -> parent.kind()
                                                                                          .isStatement())
                                                                  .isPresent();
        return localFunction
               ? Optional.of(owner)
               : Optional.empty();
    }
}
