package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MONO-IND-01: {@code case} and {@code default} labels align with their {@code switch}.
 * <p>
 * The fix shifts the whole section, label and body lines alike, by the label's indentation delta.
 */
public class CaseLabelIndentRule implements StyleRule {

    private static final String RULE_ID = "MONO-IND-01";

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
        return "Case labels aligned with switch";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.SWITCH);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var tokens = ctx.tokens();
        var indent = tokens.indentationOf(node.firstToken());
        var labels = node.children(NodeKind.CASE_LABEL);
        var diagnostics = new ArrayList<Diagnostic>();
        for (int i = 0; i < labels.size(); i++) {
            var label = labels.get(i);
            int first = label.firstToken();
            if (!tokens.isFirstOnLine(first) || tokens.indentationOf(first)
                                                      .equals(indent)) {
                continue;
            }
            int boundary = i + 1 < labels.size()
                           ? labels.get(i + 1)
                                   .firstToken()
                           : sectionEnd(node, tokens);
            sectionFix(tokens, first, boundary, indent)
                    .map(fix -> ctx.diagnostic(RULE_ID,
                                               DiagnosticSeverity.WARNING,
                                               category(),
                                               label.start(),
                                               label.first()
                                                    .end(),
                                               "Case label should align with 'switch'")
                                   .withFix(fix))
                    .ifPresent(diagnostics::add);
        }
        return diagnostics.stream();
    }

    /// Token that closes the last section: the switch's closing brace, or its last token when unbalanced.
    private static int sectionEnd(SyntaxNode node, TokenSequence tokens) {
        int brace = node.delimiter();
        int close = brace >= 0
                    ? tokens.matching(brace)
                    : -1;
        return close >= 0
               ? close
               : node.lastToken();
    }

    /// One edit per line from the label up to the boundary token, replacing the label's indentation prefix.
    private static Optional<Fix> sectionFix(TokenSequence tokens, int label, int boundary, String indent) {
        var lineMap = tokens.lineMap();
        var current = tokens.indentationOf(label);
        int firstLine = tokens.line(label);
        int lastLine = tokens.isFirstOnLine(boundary)
                       ? tokens.line(boundary) - 1
                       : tokens.line(boundary);
        var insideTokens = linesInsideTokens(tokens, label, boundary);
        var edits = new ArrayList<Edit>();
        for (int line = firstLine; line <= lastLine; line++) {
            if (insideTokens.contains(line) || lineMap.lineText(line)
                                                      .isBlank()) {
                continue;
            }
            if (!lineMap.indentation(line)
                        .startsWith(current)) {
                continue;
            }
            int start = lineMap.lineStart(line);
            edits.add(Edit.edit(start, start + current.length(), indent));
        }
        return edits.isEmpty()
               ? Optional.empty()
               : Optional.of(Fix.fix(List.copyOf(edits)));
    }

    /// Lines that begin inside a multi-line token, such as a verbatim string; their leading text is content.
    private static Set<Integer> linesInsideTokens(TokenSequence tokens, int from, int to) {
        var lines = new HashSet<Integer>();
        var lineMap = tokens.lineMap();
        for (int i = from; i <= to && i < tokens.size(); i++) {
            var token = tokens.get(i);
            int startLine = lineMap.line(token.start());
            int endLine = lineMap.line(token.end());
            for (int line = startLine + 1; line <= endLine; line++) {
                lines.add(line);
            }
        }
        return lines;
    }
}
