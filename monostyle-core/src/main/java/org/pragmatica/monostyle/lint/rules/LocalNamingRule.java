package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeFlag;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-NAM-02: Local variables use camel casing. Constants are exempt.
 */
public class LocalNamingRule implements StyleRule {

    private static final String RULE_ID = "MONO-NAM-02";

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
        return "Local variables in camel case";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.VARIABLE);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var declaration = node.parent()
                              .filter(parent -> parent.is(NodeKind.LOCAL_DECLARATION))
                              .filter(parent -> !parent.has(NodeFlag.CONST));
        var name = node.name();
        if (declaration.isEmpty() || name.isEmpty()) {
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
                                        "Local variable '" + text + "' should be camel case: '" + suggestion + "'");
        var scope = scopeOf(declaration.get());
        return Stream.of(Names.localRename(scope, Names.outermostMember(scope), text, suggestion)
                              .map(diagnostic::withFix)
                              .orElse(diagnostic));
    }

    /// Block or statement the declaration is visible in; `for` and `foreach` headers scope to the loop.
    private static SyntaxNode scopeOf(SyntaxNode declaration) {
        var parent = declaration.parent()
                                .orElse(declaration);
        if (parent.is(NodeKind.CONDITION)) {
            return parent.parent()
                         .orElse(parent);
        }
        return parent;
    }
}
