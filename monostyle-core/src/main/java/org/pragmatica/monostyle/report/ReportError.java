package org.pragmatica.monostyle.report;

/// Failures while rendering a report.
public sealed interface ReportError {
    String message();

    /// The JSON writer rejected the report.
    record SerializationFailed(String detail) implements ReportError {
        @Override
        public String message() {
            return "Cannot write JSON report: " + detail;
        }
    }

    static ReportError fromException(Throwable throwable) {
        return new SerializationFailed(throwable.getMessage());
    }
}
