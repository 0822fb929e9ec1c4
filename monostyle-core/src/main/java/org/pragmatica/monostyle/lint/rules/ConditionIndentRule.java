package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.Token;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-IND-03: Continuation lines of a wrapped condition are indented two levels past the statement,
 * and the boolean operator ends the line it continues rather than starting the next one.
 *
 * <pre>
 * if (first &amp;&amp;
 *         second)
 * </pre>
 */
public class ConditionIndentRule implements StyleRule {

    private static final String RULE_ID = "MONO-IND-03";

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
        return "Wrapped conditions indented two levels with trailing boolean operators";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.CONDITION);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var parent = node.parent();
        if (parent.isEmpty() || !(parent.get()
                                        .is(NodeKind.IF) || parent.get()
                                                                  .is(NodeKind.LOOP))) {
            return Stream.empty();
        }
        var tokens = ctx.tokens();
        var expected = ctx.indent(tokens.indentationOf(node.firstToken()), 2);
        var diagnostics = new ArrayList<Diagnostic>();
        int depth = 0;
        for (int i = node.firstToken() + 1; i < node.lastToken(); i++) {
            var token = tokens.get(i);
            boolean leading = depth == 0 && tokens.isFirstOnLine(i);
            if (token.kind()
                     .isOpening()) {
                depth++;
            } else if (token.kind()
                            .isClosing()) {
                depth--;
            }
            if (!leading || token.is(TokenKind.DOT) || token.is(TokenKind.QUESTION)) {
                continue;
            }
            if (isBooleanOperator(token)) {
                diagnostics.add(leadingOperator(ctx, i, expected));
            } else {
                Gaps.reindent(tokens, i, expected)
                    .map(edit -> ctx.diagnostic(RULE_ID,
                                                DiagnosticSeverity.WARNING,
                                                category(),
                                                token.start(),
                                                token.end(),
                                                "Condition continuation should be indented two levels past the statement")
                                    .withFix(Fix.fix(edit)))
                    .ifPresent(diagnostics::add);
            }
        }
        return diagnostics.stream();
    }

    private Diagnostic leadingOperator(RuleContext ctx, int operator, String expected) {
        var tokens = ctx.tokens();
        var token = tokens.get(operator);
        var diagnostic = ctx.diagnostic(RULE_ID,
                                        DiagnosticSeverity.WARNING,
                                        category(),
                                        token.start(),
                                        token.end(),
                                        "Boolean operator '" + token.text() + "' should end the previous line");
        if (tokens.gapHasNonWhitespace(operator - 1) || tokens.gapHasNonWhitespace(operator)) {
            return diagnostic;
        }
        var replacement = " " + token.text() + ctx.lineBreak() + expected;
        return diagnostic.withFix(Fix.fix(Edit.edit(tokens.gapStart(operator - 1), tokens.gapEnd(operator), replacement)));
    }

    static boolean isBooleanOperator(Token token) {
        return token.is(TokenKind.BINARY_OPERATOR, "&&") || token.is(TokenKind.BINARY_OPERATOR, "||");
    }
}
