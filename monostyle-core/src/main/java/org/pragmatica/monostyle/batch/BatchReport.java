package org.pragmatica.monostyle.batch;

import org.pragmatica.monostyle.format.FixSummary;
import org.pragmatica.monostyle.report.FileDiagnostics;

import java.util.List;

/// Outcomes of a batch run, ordered by file name.
public record BatchReport(List<FileOutcome> outcomes) {
    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<FileDiagnostics> fileDiagnostics() {
        return outcomes.stream()
                       .map(outcome -> FileDiagnostics.fileDiagnostics(outcome.fileName(), outcome.diagnostics()))
                       .toList();
    }

    public FixSummary summary() {
        return outcomes.stream()
                       .map(FileOutcome::summary)
                       .reduce(FixSummary.EMPTY, FixSummary::plus);
    }

    public List<FileOutcome> changed() {
        return outcomes.stream()
                       .filter(FileOutcome::changed)
                       .toList();
    }

    public long cancelledCount() {
        return outcomes.stream()
                       .filter(FileOutcome::cancelled)
                       .count();
    }
}
