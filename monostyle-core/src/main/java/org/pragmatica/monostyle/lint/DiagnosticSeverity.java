package org.pragmatica.monostyle.lint;

/**
 * Severity levels for style diagnostics, most severe first.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    ADVISORY;

    public String label() {
        return name().toLowerCase();
    }
}
