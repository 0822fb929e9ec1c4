package org.pragmatica.monostyle.cli;

import org.pragmatica.monostyle.batch.BatchReport;
import org.pragmatica.monostyle.batch.Mode;
import org.pragmatica.monostyle.batch.StyleBatch;
import org.pragmatica.monostyle.format.CancellationToken;
import org.pragmatica.monostyle.report.ExitStatus;
import org.pragmatica.monostyle.report.ReportException;
import org.pragmatica.monostyle.report.Reporter;
import org.pragmatica.monostyle.shared.SourceFile;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Shared pipeline of the `check` and `format` commands: collect, load, run, report.
final class StyleRun {
    private final StyleOptions options;
    private final PrintWriter out;
    private final PrintWriter err;
    private final List<String> inputErrors = new ArrayList<>();

    StyleRun(StyleOptions options, PrintWriter out, PrintWriter err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /// Collect and decode inputs; rejected files are reported on stderr.
    List<SourceFile> load(List<Path> paths) {
        var files = FileCollector.collectSourceFiles(paths, this::inputError);
        return SourceLoader.load(files, error -> inputError(error.message()));
    }

    BatchReport run(List<SourceFile> sources, Mode mode) {
        var config = options.toConfig();
        return StyleBatch.styleBatch(config, options.threads)
                         .run(sources, mode, CancellationToken.cancellationToken());
    }

    /// Print the report and compute the exit code. Rejected inputs count as errors.
    int report(BatchReport batch) {
        var reporter = Reporter.reporter();
        var records = reporter.report(batch.fileDiagnostics());
        if (options.json) {
            try {
                out.println(reporter.json(records, batch.summary()));
            } catch (ReportException e) {
                err.println("Error: " + e.getMessage());
                return ExitStatus.ERRORS.code();
            }
        } else {
            out.println(reporter.human(records));
        }
        out.flush();
        err.flush();
        if (!inputErrors.isEmpty()) {
            return ExitStatus.ERRORS.code();
        }
        return ExitStatus.from(records, !options.noFailOnWarning)
                         .code();
    }

    boolean hasInputErrors() {
        return !inputErrors.isEmpty();
    }

    PrintWriter out() {
        return out;
    }

    PrintWriter err() {
        return err;
    }

    private void inputError(String message) {
        inputErrors.add(message);
        err.println("Error: " + message);
    }
}
