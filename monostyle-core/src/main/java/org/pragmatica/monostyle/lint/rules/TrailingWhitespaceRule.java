package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
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
 * MONO-SPC-09: No trailing whitespace. Lines inside multi-line string literals are left untouched.
 */
public class TrailingWhitespaceRule implements StyleRule {

    private static final String RULE_ID = "MONO-SPC-09";

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
        return "No trailing whitespace";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var text = ctx.text();
        var lineMap = ctx.lineMap();
        var literals = multiLineLiterals(ctx);
        var diagnostics = new ArrayList<Diagnostic>();
        for (int line = 1; line <= lineMap.lineCount(); line++) {
            int lineStart = lineMap.lineStart(line);
            int end = lineMap.lineContentEnd(line);
            int start = end;
            while (start > lineStart && (text.charAt(start - 1) == ' ' || text.charAt(start - 1) == '\t')) {
                start--;
            }
            if (start == end || insideLiteral(literals, start)) {
                continue;
            }
            diagnostics.add(ctx.diagnostic(RULE_ID, DiagnosticSeverity.WARNING, category(), start, end, "Trailing whitespace")
                               .withFix(Fix.fix(Edit.delete(start, end))));
        }
        return diagnostics.stream();
    }

    private static List<int[]> multiLineLiterals(RuleContext ctx) {
        var ranges = new ArrayList<int[]>();
        for (var token : ctx.tokens()
                            .tokens()) {
            if ((token.is(TokenKind.STRING) || token.is(TokenKind.ERROR)) && (token.text()
                                                                                  .indexOf('\n') >= 0 || token.text()
                                                                                                              .indexOf('\r') >= 0)) {
                ranges.add(new int[]{token.start(), token.end()});
            }
        }
        return ranges;
    }

    private static boolean insideLiteral(List<int[]> ranges, int offset) {
        return ranges.stream()
                     .anyMatch(range -> offset > range[0] && offset < range[1]);
    }
}
