package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.shared.SourceFile;

import java.util.List;

/**
 * Outcome of formatting one file.
 *
 * @param source       formatted source; the original when cancelled
 * @param appliedCount number of fixes applied over all passes
 * @param remaining    diagnostics of the final text
 * @param cancelled    true when the run was abandoned and the text left untouched
 */
public record FormatResult(SourceFile source,
                           int appliedCount,
                           List<Diagnostic> remaining,
                           FixSummary summary,
                           boolean cancelled) {
    public FormatResult {
        remaining = List.copyOf(remaining);
    }

    static FormatResult cancelled(SourceFile original) {
        return new FormatResult(original, 0, List.of(), FixSummary.EMPTY, true);
    }

    public boolean changed(SourceFile original) {
        return !source.content()
                      .equals(original.content());
    }
}
