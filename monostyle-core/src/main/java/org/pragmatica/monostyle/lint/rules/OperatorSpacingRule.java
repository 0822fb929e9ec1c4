package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.Token;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-SPC-06: One space on each side of binary, assignment and lambda operators.
 *
 * A side that touches a parenthesis is not checked. Operators that may be unary ({@code -}, {@code +},
 * {@code *}, {@code &}) count as binary only after an operand.
 */
public class OperatorSpacingRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-06";
    private static final Set<String> OPERAND_KEYWORDS = Set.of("this", "base", "true", "false", "null");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.SPACING;
    }

    @Override
    public String description() {
        return "One space around binary, assignment and '=>' operators";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        var diagnostics = new ArrayList<Diagnostic>();
        for (int i = 1; i < tokens.lastIndex(); i++) {
            var token = tokens.get(i);
            if (!isSpacedOperator(tokens, i)) {
                continue;
            }
            if (!isParenthesis(tokens.get(i - 1))) {
                Gaps.expectInline(ctx,
                                  RULE_ID,
                                  category(),
                                  i - 1,
                                  " ",
                                  "Expected one space before '" + token.text() + "'")
                    .ifPresent(diagnostics::add);
            }
            if (!isParenthesis(tokens.get(i + 1)) && !tokens.get(i + 1)
                                                            .is(TokenKind.END_OF_FILE)) {
                Gaps.expectInline(ctx,
                                  RULE_ID,
                                  category(),
                                  i,
                                  " ",
                                  "Expected one space after '" + token.text() + "'")
                    .ifPresent(diagnostics::add);
            }
        }
        return diagnostics.stream();
    }

    private static boolean isSpacedOperator(TokenSequence tokens, int index) {
        var token = tokens.get(index);
        return switch (token.kind()) {
            case ASSIGNMENT, ARROW -> true;
            case BINARY_OPERATOR -> isOperand(tokens.get(index - 1));
            default -> false;
        };
    }

    private static boolean isOperand(Token token) {
        return switch (token.kind()) {
            case IDENTIFIER, NUMBER, STRING, CHAR, CLOSE_PAREN, CLOSE_BRACKET, GENERIC_CLOSE -> true;
            case KEYWORD -> OPERAND_KEYWORDS.contains(token.text());
            case UNARY_OPERATOR -> token.text()
                                        .equals("++") || token.text()
                                                              .equals("--");
            default -> false;
        };
    }

    private static boolean isParenthesis(Token token) {
        return token.is(TokenKind.OPEN_PAREN) || token.is(TokenKind.CLOSE_PAREN);
    }
}
