package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.StructuralProblem;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-STR-01..03: Problems found by the structural parser, reported as errors spanning the affected
 * region from the offending token to the end of the file. Never fixed.
 */
public class StructuralProblemRule implements StyleRule {

    private static final String RULE_ID = "MONO-STR";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.STRUCTURE;
    }

    @Override
    public String description() {
        return "Balanced braces, delimiters and terminated literals";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        int end = ctx.text()
                     .length();
        return ctx.parse()
                  .problems()
                  .stream()
                  .map(problem -> ctx.diagnostic(idOf(problem),
                                                 DiagnosticSeverity.ERROR,
                                                 category(),
                                                 tokens.get(problem.token())
                                                       .start(),
                                                 end,
                                                 problem.message()));
    }

    static String idOf(StructuralProblem problem) {
        if (problem instanceof StructuralProblem.UnbalancedBraces) {
            return "MONO-STR-01";
        }
        if (problem instanceof StructuralProblem.MalformedToken) {
            return "MONO-STR-02";
        }
        return "MONO-STR-03";
    }
}
