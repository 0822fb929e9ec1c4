package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.lint.Diagnostic;

import java.util.List;

/// Rewritten text together with the diagnostics whose fixes went in and those that were skipped.
public record MergeResult(String text, List<Diagnostic> applied, List<SkippedEdit> skipped) {
    public MergeResult {
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
    }

    public boolean changed() {
        return !applied.isEmpty();
    }

    public long skippedFor(SkipReason reason) {
        return skipped.stream()
                      .filter(skip -> skip.reason() == reason)
                      .count();
    }
}
