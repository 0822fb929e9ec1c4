package org.pragmatica.monostyle.lint;

import java.util.Optional;

/**
 * A single style finding with its location and optional fix.
 *
 * @param ruleId   rule identifier, e.g. {@code MONO-SPC-01}
 * @param start    character offset where the offending span starts
 * @param end      character offset where the offending span ends
 * @param line     1-based line of {@code start}
 * @param column   1-based column of {@code start}
 */
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         RuleCategory category,
                         String file,
                         int start,
                         int end,
                         int line,
                         int column,
                         String message,
                         Optional<Fix> fix) {

    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        RuleCategory category,
                                        String file,
                                        int start,
                                        int end,
                                        int line,
                                        int column,
                                        String message) {
        return new Diagnostic(ruleId, severity, category, file, start, end, line, column, message, Optional.empty());
    }

    /**
     * Builder-style method to attach a fix.
     */
    public Diagnostic withFix(Fix fix) {
        return new Diagnostic(ruleId, severity, category, file, start, end, line, column, message, Optional.of(fix));
    }

    /**
     * Builder-style method to override severity.
     */
    public Diagnostic withSeverity(DiagnosticSeverity newSeverity) {
        return new Diagnostic(ruleId, newSeverity, category, file, start, end, line, column, message, fix);
    }

    public boolean isFixable() {
        return fix.isPresent();
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }
}
