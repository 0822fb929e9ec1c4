package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-BRC-04: Control blocks, lambdas and anonymous constructs open their brace on the same line,
 * and {@code else} follows a closing brace on that brace's line.
 */
public class BlockBraceRule implements StyleRule {

    private static final String RULE_ID = "MONO-BRC-04";

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
        return "Control, lambda and anonymous braces on the same line";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.IF,
                      NodeKind.ELSE_CLAUSE,
                      NodeKind.LOOP,
                      NodeKind.SWITCH,
                      NodeKind.BLOCK_STATEMENT,
                      NodeKind.LAMBDA,
                      NodeKind.ANONYMOUS);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        var diagnostics = new ArrayList<Diagnostic>();
        // blocks inside switch sections are statements, not the switch body
        var blocks = node.is(NodeKind.SWITCH)
                     ? List.<SyntaxNode>of()
                     : node.children(NodeKind.BLOCK);
        if (blocks.isEmpty() && node.delimiter() > 0) {
            Braces.expectSameLine(ctx, RULE_ID, node.delimiter(), "Opening brace belongs on the same line")
                  .ifPresent(diagnostics::add);
        }
        for (var block : blocks) {
            Braces.expectSameLine(ctx, RULE_ID, block.firstToken(), "Opening brace belongs on the same line")
                  .ifPresent(diagnostics::add);
        }
        int keyword = node.firstToken();
        if (node.is(NodeKind.ELSE_CLAUSE) && keyword > 0 && tokens.get(keyword - 1)
                                                                  .is(TokenKind.CLOSE_BRACE)) {
            Braces.expectSameLine(ctx, RULE_ID, keyword, "'else' belongs on the line of the closing brace")
                  .ifPresent(diagnostics::add);
        }
        if (node.is(NodeKind.LOOP) && tokens.get(keyword)
                                            .isKeyword("do") && !blocks.isEmpty()) {
            int next = blocks.get(0)
                             .lastToken() + 1;
            if (tokens.get(next)
                      .isKeyword("while")) {
                Braces.expectSameLine(ctx, RULE_ID, next, "'while' belongs on the line of the closing brace")
                      .ifPresent(diagnostics::add);
            }
        }
        return diagnostics.stream();
    }
}
