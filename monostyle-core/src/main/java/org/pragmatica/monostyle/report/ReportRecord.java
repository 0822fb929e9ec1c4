package org.pragmatica.monostyle.report;

import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;

/// One line of the report.
public record ReportRecord(String file, int line, int column, String ruleId, DiagnosticSeverity severity, String message) {
    public static ReportRecord reportRecord(String file, Diagnostic diagnostic) {
        return new ReportRecord(file,
                                diagnostic.line(),
                                diagnostic.column(),
                                diagnostic.ruleId(),
                                diagnostic.severity(),
                                diagnostic.message());
    }

    /// `file:line:column: severity [rule] message`
    public String toHumanString() {
        return file + ":" + line + ":" + column + ": " + severity.label() + " [" + ruleId + "] " + message;
    }
}
