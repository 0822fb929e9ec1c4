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
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * MONO-LEN-01: Physical lines stay within the configured width, tabs counting as {@code tabWidth} columns.
 *
 * <p>Two shapes are wrapped automatically: a condition with boolean operators, broken after each
 * operator, and a call whose argument list fits on the line, broken after each argument separator.
 * Continuation lines are indented two levels. Other long lines are advisory.
 */
public class LineLengthRule implements StyleRule {

    private static final String RULE_ID = "MONO-LEN-01";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.LINE_LENGTH;
    }

    @Override
    public String description() {
        return "Lines within the configured width";
    }

    @Override
    public Set<NodeKind> interests() {
        return Set.of(NodeKind.COMPILATION_UNIT);
    }

    @Override
    public Stream<Diagnostic> analyze(SyntaxNode node, RuleContext ctx) {
        var config = ctx.config();
        var lineMap = ctx.lineMap();
        var wraps = wraps(node, ctx);
        var diagnostics = new ArrayList<Diagnostic>();
        for (int line = 1; line <= lineMap.lineCount(); line++) {
            int width = lineMap.displayWidth(line, config.tabWidth());
            if (width <= config.maxLineLength()) {
                continue;
            }
            var message = "Line is " + width + " columns long, limit is " + config.maxLineLength();
            var fix = Optional.ofNullable(wraps.get(line));
            var severity = fix.isPresent()
                           ? DiagnosticSeverity.WARNING
                           : DiagnosticSeverity.ADVISORY;
            var diagnostic = ctx.diagnostic(RULE_ID,
                                            severity,
                                            category(),
                                            lineMap.lineStart(line),
                                            lineMap.lineContentEnd(line),
                                            message);
            diagnostics.add(fix.map(diagnostic::withFix)
                               .orElse(diagnostic));
        }
        return diagnostics.stream();
    }

    /// First applicable wrap per line; conditions take priority over calls.
    private Map<Integer, Fix> wraps(SyntaxNode root, RuleContext ctx) {
        var tokens = ctx.tokens();
        var result = new HashMap<Integer, Fix>();
        root.descendants()
            .filter(node -> node.is(NodeKind.CONDITION))
            .forEach(condition -> conditionWrap(condition, ctx).ifPresent(fix -> result.putIfAbsent(tokens.line(condition.firstToken()),
                                                                                                    fix)));
        root.descendants()
            .filter(node -> node.is(NodeKind.CALL) && node.delimiter() >= 0)
            .forEach(call -> callWrap(call, ctx).ifPresent(fix -> result.putIfAbsent(tokens.line(call.delimiter()),
                                                                                    fix)));
        return result;
    }

    private Optional<Fix> conditionWrap(SyntaxNode condition, RuleContext ctx) {
        var statement = condition.parent();
        if (statement.isEmpty() || !(statement.get()
                                              .is(NodeKind.IF) || statement.get()
                                                                           .is(NodeKind.LOOP))) {
            return Optional.empty();
        }
        var tokens = ctx.tokens();
        var breaks = topLevel(tokens, condition.firstToken(), condition.lastToken(), ConditionIndentRule::isBooleanOperator);
        var indent = ctx.indent(tokens.indentationOf(condition.firstToken()), 2);
        return breakAfter(tokens, breaks, tokens.line(condition.firstToken()), ctx.lineBreak() + indent);
    }

    private Optional<Fix> callWrap(SyntaxNode call, RuleContext ctx) {
        var tokens = ctx.tokens();
        int open = call.delimiter();
        int close = tokens.matching(open);
        if (close < 0 || tokens.line(open) != tokens.line(close)) {
            return Optional.empty();
        }
        var commas = topLevel(tokens, open, close, token -> token.is(TokenKind.COMMA));
        var indent = ctx.indent(tokens.indentationOf(open), 2);
        return breakAfter(tokens, commas, tokens.line(open), ctx.lineBreak() + indent);
    }

    /// Indexes strictly between the delimiters, at their nesting level, matching the predicate.
    private static List<Integer> topLevel(TokenSequence tokens,
                                          int open,
                                          int close,
                                          Predicate<Token> predicate) {
        var result = new ArrayList<Integer>();
        int depth = 0;
        for (int i = open + 1; i < close; i++) {
            var token = tokens.get(i);
            if (token.kind()
                     .isOpening()) {
                depth++;
            } else if (token.kind()
                            .isClosing()) {
                depth--;
            } else if (depth == 0 && predicate.test(token)) {
                result.add(i);
            }
        }
        return result;
    }

    private static Optional<Fix> breakAfter(TokenSequence tokens, List<Integer> indexes, int line, String replacement) {
        var edits = new ArrayList<Edit>();
        for (int index : indexes) {
            if (tokens.line(index) != line) {
                continue;
            }
            if (!Gaps.isInline(tokens, index)) {
                return Optional.empty();
            }
            edits.add(Edit.edit(tokens.gapStart(index), tokens.gapEnd(index), replacement));
        }
        return edits.isEmpty()
               ? Optional.empty()
               : Optional.of(Fix.fix(edits));
    }
}
