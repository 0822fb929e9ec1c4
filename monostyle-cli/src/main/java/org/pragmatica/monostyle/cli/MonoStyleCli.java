package org.pragmatica.monostyle.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Command-line entry point.
///
/// Usage examples:
/// ```
/// monostyle check src/
/// monostyle check --json --max-line-length 100 Foo.cs
/// monostyle format --dry-run src/
/// ```
@Command(name = "monostyle",
        mixinStandardHelpOptions = true,
        version = "monostyle 0.1.0",
        description = "Checks and fixes C# sources against the Mono coding guidelines",
        subcommands = {CheckCommand.class, FormatCommand.class})
public class MonoStyleCli implements Runnable {

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new MonoStyleCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
