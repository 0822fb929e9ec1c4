package org.pragmatica.monostyle.report;

import org.pragmatica.monostyle.lint.DiagnosticSeverity;

import java.util.Collection;

/**
 * Process exit status derived from the remaining diagnostics.
 *
 * <p>Any error gives {@link #ERRORS}. Warnings give {@link #WARNINGS} when {@code failOnWarning} is on,
 * otherwise {@link #SUCCESS} with the count still shown in the report. Advisories never fail a run.
 */
public enum ExitStatus {
    SUCCESS(0),
    WARNINGS(1),
    ERRORS(2);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitStatus from(Collection<ReportRecord> records, boolean failOnWarning) {
        if (records.stream()
                   .anyMatch(record -> record.severity() == DiagnosticSeverity.ERROR)) {
            return ERRORS;
        }
        if (failOnWarning && records.stream()
                                    .anyMatch(record -> record.severity() == DiagnosticSeverity.WARNING)) {
            return WARNINGS;
        }
        return SUCCESS;
    }
}
