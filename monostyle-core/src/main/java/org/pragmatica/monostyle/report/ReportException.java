package org.pragmatica.monostyle.report;

/// Carries a {@link ReportError} out of the reporter.
public class ReportException extends Exception {
    private final ReportError error;

    public ReportException(ReportError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ReportError error() {
        return error;
    }
}
