package org.pragmatica.monostyle.batch;

import org.pragmatica.monostyle.format.FixSummary;
import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.shared.SourceFile;

import java.util.List;

/**
 * Result of processing one file.
 *
 * @param original    the input
 * @param result      the text after fixing; equal to {@code original} in check mode or when cancelled
 * @param diagnostics diagnostics of {@code result}
 */
public record FileOutcome(SourceFile original,
                          SourceFile result,
                          List<Diagnostic> diagnostics,
                          FixSummary summary,
                          boolean cancelled) {
    public FileOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    static FileOutcome cancelled(SourceFile original) {
        return new FileOutcome(original, original, List.of(), FixSummary.EMPTY, true);
    }

    public boolean changed() {
        return !result.content()
                      .equals(original.content());
    }

    public String fileName() {
        return original.fileName();
    }
}
