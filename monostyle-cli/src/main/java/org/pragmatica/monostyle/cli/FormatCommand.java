package org.pragmatica.monostyle.cli;

import org.pragmatica.monostyle.batch.BatchReport;
import org.pragmatica.monostyle.batch.Mode;
import org.pragmatica.monostyle.report.ExitStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Format command: apply automatic fixes and report what remains.
 */
@Command(name = "format",
        description = "Fix style violations in place and report what remains",
        mixinStandardHelpOptions = true)
public class FormatCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Parameters(paramLabel = "<path>",
            description = "Files or directories to format",
            arity = "1..*")
    List<Path> paths;

    @Option(names = "--dry-run",
            description = "Compute fixes but do not write files")
    boolean dryRun;

    @Mixin
    StyleOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        var run = new StyleRun(options,
                               spec.commandLine()
                                   .getOut(),
                               spec.commandLine()
                                   .getErr());
        var sources = run.load(paths);
        if (sources.isEmpty() && !run.hasInputErrors()) {
            run.err()
               .println("No C# files found.");
            run.err()
               .flush();
            return 0;
        }
        var batch = run.run(sources, Mode.FIX);
        if (!write(batch, run)) {
            run.report(batch);
            return ExitStatus.ERRORS.code();
        }
        return run.report(batch);
    }

    private boolean write(BatchReport batch, StyleRun run) {
        boolean ok = true;
        for (var outcome : batch.changed()) {
            var target = outcome.original()
                                .path();
            if (dryRun) {
                run.err()
                   .println("Would format: " + target);
                continue;
            }
            try {
                SourceWriter.write(target,
                                   outcome.result()
                                          .content());
                log.debug("Formatted {}", target);
                run.err()
                   .println("Formatted: " + target);
            } catch (IOException e) {
                run.err()
                   .println("Error: cannot write " + target + ": " + e.getMessage());
                ok = false;
            }
        }
        run.err()
           .flush();
        return ok;
    }
}
