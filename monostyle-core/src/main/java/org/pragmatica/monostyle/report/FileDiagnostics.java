package org.pragmatica.monostyle.report;

import org.pragmatica.monostyle.lint.Diagnostic;

import java.util.List;

/// Diagnostics found in one file.
public record FileDiagnostics(String file, List<Diagnostic> diagnostics) {
    public FileDiagnostics {
        diagnostics = List.copyOf(diagnostics);
    }

    public static FileDiagnostics fileDiagnostics(String file, List<Diagnostic> diagnostics) {
        return new FileDiagnostics(file, diagnostics);
    }
}
