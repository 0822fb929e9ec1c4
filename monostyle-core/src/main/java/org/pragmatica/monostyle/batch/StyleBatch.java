package org.pragmatica.monostyle.batch;

import org.pragmatica.monostyle.format.CancellationToken;
import org.pragmatica.monostyle.format.FixSummary;
import org.pragmatica.monostyle.format.StyleFormatter;
import org.pragmatica.monostyle.lint.Diagnostic;
import org.pragmatica.monostyle.lint.DiagnosticSeverity;
import org.pragmatica.monostyle.lint.RuleCategory;
import org.pragmatica.monostyle.lint.StyleConfig;
import org.pragmatica.monostyle.shared.SourceFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pipeline over many files on a fixed worker pool, one task per file.
 *
 * <p>Tasks share only the immutable configuration. Results are collected after every task has
 * finished and ordered by file name, so the report does not depend on scheduling.
 */
public final class StyleBatch {
    private static final Logger log = LoggerFactory.getLogger(StyleBatch.class);

    private final StyleFormatter formatter;
    private final int threads;

    private StyleBatch(StyleConfig config, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.formatter = StyleFormatter.styleFormatter(config);
        this.threads = threads;
    }

    public static StyleBatch styleBatch(StyleConfig config, int threads) {
        return new StyleBatch(config, threads);
    }

    public static StyleBatch styleBatch(StyleConfig config) {
        return new StyleBatch(config, Runtime.getRuntime()
                                             .availableProcessors());
    }

    public BatchReport run(List<SourceFile> files, Mode mode, CancellationToken cancellation) {
        var executor = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        try {
            var futures = new ArrayList<Future<FileOutcome>>(files.size());
            for (var file : files) {
                futures.add(executor.submit(() -> process(file, mode, cancellation)));
            }
            var outcomes = new ArrayList<FileOutcome>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), files.get(i), cancellation));
            }
            outcomes.sort(Comparator.comparing(FileOutcome::fileName));
            log.debug("Processed {} files in {} mode", outcomes.size(), mode);
            return new BatchReport(outcomes);
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome process(SourceFile file, Mode mode, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return FileOutcome.cancelled(file);
        }
        try {
            if (mode == Mode.CHECK) {
                return formatter.check(file, cancellation)
                                .map(diagnostics -> new FileOutcome(file, file, diagnostics, FixSummary.EMPTY, false))
                                .orElseGet(() -> FileOutcome.cancelled(file));
            }
            var result = formatter.format(file, cancellation);
            if (result.cancelled()) {
                return FileOutcome.cancelled(file);
            }
            return new FileOutcome(file, result.source(), result.remaining(), result.summary(), false);
        } catch (RuntimeException e) {
            log.error("Pipeline failed for {}", file.fileName(), e);
            return new FileOutcome(file, file, List.of(pipelineFailure(file, e)), FixSummary.EMPTY, false);
        }
    }

    private static FileOutcome await(Future<FileOutcome> future, SourceFile file, CancellationToken cancellation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread()
                  .interrupt();
            cancellation.cancel();
            return FileOutcome.cancelled(file);
        } catch (ExecutionException e) {
            log.error("Task failed for {}", file.fileName(), e.getCause());
            return new FileOutcome(file, file, List.of(pipelineFailure(file, e.getCause())), FixSummary.EMPTY, false);
        }
    }

    private static Diagnostic pipelineFailure(SourceFile file, Throwable cause) {
        return Diagnostic.diagnostic("MONO-INT-01",
                                     DiagnosticSeverity.ADVISORY,
                                     RuleCategory.INTERNAL,
                                     file.fileName(),
                                     0,
                                     0,
                                     1,
                                     1,
                                     "Analysis failed and the file was left unchanged: " + cause.getMessage());
    }
}
