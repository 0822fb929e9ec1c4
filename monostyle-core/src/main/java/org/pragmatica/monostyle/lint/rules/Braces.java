package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.parser.NodeKind;
import org.pragmatica.monostyle.parser.SyntaxNode;

import java.util.Optional;

/// Placement checks shared by the brace rules.
final class Braces {
    private Braces() {}

    /// The token must follow its predecessor on the same line, separated by one space.
    static Optional<Diagnostic> expectSameLine(RuleContext ctx, String ruleId, int token, String message) {
        var tokens = ctx.tokens();
        int previous = token - 1;
        if (previous < 0) {
            return Optional.empty();
        }
        if (!tokens.gapHasNewline(previous) && tokens.gapText(previous)
                                                     .equals(" ")) {
            return Optional.empty();
        }
        return Optional.of(fixedGap(ctx, ruleId, previous, " ", message));
    }

    /// The token must start its own line, indented exactly as given.
    static Optional<Diagnostic> expectOwnLine(RuleContext ctx, String ruleId, int token, String indent, String message) {
        var tokens = ctx.tokens();
        int previous = token - 1;
        if (previous < 0) {
            return Optional.empty();
        }
        if (tokens.gapHasNewline(previous) && tokens.isFirstOnLine(token)) {
            return Gaps.reindent(tokens, token, indent)
                       .map(edit -> diagnostic(ctx, ruleId, token, message).withFix(Fix.fix(edit)));
        }
        return Optional.of(fixedGap(ctx, ruleId, previous, ctx.lineBreak() + indent, message));
    }

    /// Wrap the unbraced body of an `if` in braces, keeping the body text verbatim.
    static Optional<Fix> wrapBody(RuleContext ctx, SyntaxNode statement, SyntaxNode condition, SyntaxNode body) {
        var tokens = ctx.tokens();
        int closeParen = condition.lastToken();
        if (tokens.gapHasNonWhitespace(closeParen) || body.firstToken() != closeParen + 1) {
            return Optional.empty();
        }
        var indent = tokens.indentationOf(statement.firstToken());
        var lineBreak = ctx.lineBreak();
        var replacement = " {" + lineBreak + ctx.indent(indent, 1) + body.text() + lineBreak + indent + "}";
        return Optional.of(Fix.fix(Edit.edit(tokens.gapStart(closeParen), body.end(), replacement)));
    }

    /// Statement controlled by an `if`, when it is not a block.
    static Optional<SyntaxNode> unbracedBody(SyntaxNode statement) {
        return statement.children()
                        .stream()
                        .filter(child -> !child.is(NodeKind.CONDITION) && !child.is(NodeKind.ELSE_CLAUSE))
                        .findFirst()
                        .filter(child -> !child.is(NodeKind.BLOCK));
    }

    private static Diagnostic fixedGap(RuleContext ctx, String ruleId, int previous, String replacement, String message) {
        var tokens = ctx.tokens();
        var diagnostic = diagnostic(ctx, ruleId, previous + 1, message);
        if (tokens.gapHasNonWhitespace(previous)) {
            return diagnostic;
        }
        return diagnostic.withFix(Fix.fix(Edit.edit(tokens.gapStart(previous), tokens.gapEnd(previous), replacement)));
    }

    private static Diagnostic diagnostic(RuleContext ctx, String ruleId, int token, String message) {
        var target = ctx.tokens()
                        .get(token);
        return ctx.diagnostic(ruleId, DiagnosticSeverity.WARNING, RuleCategory.BRACES, target.start(), target.end(), message);
    }
}
