package org.pragmatica.monostyle.cli;

import org.pragmatica.monostyle.batch.Mode;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Check command: report style violations without modifying files.
 * <p>
 * Exit codes: 0 when clean, 1 when warnings remain (unless {@code --no-fail-on-warning}),
 * 2 on errors or rejected input.
 */
@Command(name = "check",
        description = "Report style violations without modifying files",
        mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {

    @Parameters(paramLabel = "<path>",
            description = "Files or directories to check",
            arity = "1..*")
    List<Path> paths;

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
        return run.report(run.run(sources, Mode.CHECK));
    }
}
