package org.pragmatica.monostyle.lint.rules;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.Edit;
import org.pragmatica.monostyle.lint.Fix;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.RuleContext;
import org.pragmatica.monostyle.token.TokenSequence;

import java.util.Optional;

/// Shared helpers for rules that rewrite the whitespace between two tokens.
final class Gaps {
    private Gaps() {}

    /// True when the gap after the token stays on one line and holds no comment or directive.
    static boolean isInline(TokenSequence tokens, int index) {
        return index >= 0 && index < tokens.lastIndex() && !tokens.gapHasNewline(index) && !tokens.gapHasNonWhitespace(index);
    }

    /// Diagnostic with a fix when an inline gap differs from the expected text.
    static Optional<Diagnostic> expectInline(RuleContext ctx,
                                             String ruleId,
                                             RuleCategory category,
                                             int index,
                                             String expected,
                                             String message) {
        var tokens = ctx.tokens();
        if (!isInline(tokens, index) || tokens.gapText(index)
                                              .equals(expected)) {
            return Optional.empty();
        }
        int start = tokens.gapStart(index);
        int end = tokens.gapEnd(index);
        return Optional.of(ctx.diagnostic(ruleId, DiagnosticSeverity.WARNING, category, start, end, message)
                              .withFix(Fix.fix(Edit.edit(start, end, expected))));
    }

    /// Edit that replaces the indentation before a line-leading token, when it differs.
    static Optional<Edit> reindent(TokenSequence tokens, int index, String expected) {
        if (!tokens.isFirstOnLine(index)) {
            return Optional.empty();
        }
        int lineStart = tokens.indentationStart(index);
        int tokenStart = tokens.get(index)
                               .start();
        if (tokens.text()
                  .substring(lineStart, tokenStart)
                  .equals(expected)) {
            return Optional.empty();
        }
        return Optional.of(Edit.edit(lineStart, tokenStart, expected));
    }
}
