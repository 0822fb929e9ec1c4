package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-IND-04: A line starting with {@code .} continues a member-access chain and is indented one
 * level past the line holding the chain's initial receiver.
 */
public class ChainIndentRule implements StyleRule {

    private static final String RULE_ID = "MONO-IND-04";

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
        return "Chain continuation indented one level past the receiver";
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
            if (!token.is(TokenKind.DOT, ".") || !tokens.isFirstOnLine(i)) {
                continue;
            }
            int receiver = receiverStart(tokens, i);
            if (receiver < 0 || receiver >= i) {
                continue;
            }
            var expected = ctx.indent(tokens.indentationOf(receiver), 1);
            Gaps.reindent(tokens, i, expected)
                .map(edit -> ctx.diagnostic(RULE_ID,
                                            DiagnosticSeverity.WARNING,
                                            category(),
                                            token.start(),
                                            token.end(),
                                            "Chain continuation should be indented one level past its receiver")
                                .withFix(Fix.fix(edit)))
                .ifPresent(diagnostics::add);
        }
        return diagnostics.stream();
    }

    /// Walk back over the primary chain ending just before the dot and return its first token.
    static int receiverStart(TokenSequence tokens, int dot) {
        int j = dot - 1;
        while (j >= 0) {
            var token = tokens.get(j);
            switch (token.kind()) {
                case CLOSE_PAREN, CLOSE_BRACKET, GENERIC_CLOSE -> {
                    int open = tokens.matching(j);
                    if (open < 0) {
                        return -1;
                    }
                    if (open > 0 && continuesChain(tokens, open - 1)) {
                        j = open - 1;
                    } else {
                        return open;
                    }
                }
                case QUESTION -> j--;
                case IDENTIFIER, KEYWORD, NUMBER, STRING, CHAR -> {
                    if (j > 0 && tokens.get(j - 1)
                                       .is(TokenKind.DOT)) {
                        j -= 2;
                    } else if (j > 0 && tokens.get(j - 1)
                                              .isKeyword("new")) {
                        return j - 1;
                    } else {
                        return j;
                    }
                }
                default -> {
                    return j + 1;
                }
            }
        }
        return -1;
    }

    private static boolean continuesChain(TokenSequence tokens, int index) {
        var kind = tokens.get(index)
                         .kind();
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.GENERIC_CLOSE || kind == TokenKind.CLOSE_PAREN || kind == TokenKind.CLOSE_BRACKET || (kind == TokenKind.KEYWORD && !isStatementKeyword(tokens.get(index)
                                                                                                                                                                                                                         .text()));
    }

    private static boolean isStatementKeyword(String keyword) {
        return switch (keyword) {
            case "if", "while", "for", "foreach", "switch", "catch", "using", "lock", "fixed", "return", "new", "in", "is", "as" -> true;
            default -> false;
        };
    }
}
