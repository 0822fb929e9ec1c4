package org.pragmatica.monostyle.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class MonoStyleCliTest {

    private static final String CLEAN = "class Clean {\n}\n";
    private static final String MESSY = "class Messy {\n\tvoid Run ()\n\t{\n\t\tcall(a);\n\t}\n}\n";
    private static final String BROKEN = "class Broken {\n";

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        cli = MonoStyleCli.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @Test
    void check_cleanFile_exitsZero() throws IOException {
        write("Clean.cs", CLEAN);

        int exitCode = cli.execute("check", dir.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("0 error(s), 0 warning(s), 0 advisory note(s)");
    }

    @Test
    void check_warnings_exitOneAndLeaveFileAlone() throws IOException {
        var file = write("Messy.cs", MESSY);

        int exitCode = cli.execute("check", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains(file + ":4:7: warning [MONO-SPC-01]")
                                  .contains("0 error(s), 1 warning(s)");
        assertThat(Files.readString(file)).isEqualTo(MESSY);
    }

    @Test
    void check_warningsWithoutFailOnWarning_exitZero() throws IOException {
        var file = write("Messy.cs", MESSY);

        assertThat(cli.execute("check", "--no-fail-on-warning", file.toString())).isZero();
    }

    @Test
    void check_disabledRule_isNotReported() throws IOException {
        var file = write("Messy.cs", MESSY);

        assertThat(cli.execute("check", "--disable", "MONO-SPC-01,MONO-LEN-01", file.toString())).isZero();
    }

    @Test
    void check_structuralProblem_exitsTwo() throws IOException {
        var file = write("Broken.cs", BROKEN);

        assertThat(cli.execute("check", file.toString())).isEqualTo(2);
        assertThat(out.toString()).contains("error [MONO-STR-01]");
    }

    @Test
    void check_binaryInput_isRejected() throws IOException {
        var file = dir.resolve("Blob.cs");
        Files.write(file, new byte[] {'c', 0, 'x'});

        assertThat(cli.execute("check", file.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("Error: Binary content rejected: " + file);
    }

    @Test
    void check_missingPath_exitsTwo() {
        assertThat(cli.execute("check", dir.resolve("absent.cs")
                                           .toString())).isEqualTo(2);
        assertThat(err.toString()).contains("No such file or directory");
    }

    @Test
    void check_emptyDirectory_reportsNoFiles() {
        assertThat(cli.execute("check", dir.toString())).isZero();
        assertThat(err.toString()).contains("No C# files found.");
    }

    @Test
    void check_json_printsMachineReadableReport() throws IOException {
        var file = write("Messy.cs", MESSY);

        cli.execute("check", "--json", file.toString());

        assertThat(out.toString()).contains("\"diagnostics\"")
                                  .contains("\"counts\"")
                                  .contains("MONO-SPC-01");
    }

    @Test
    void format_rewritesFileAndExitsZero() throws IOException {
        var file = write("Messy.cs", MESSY);

        int exitCode = cli.execute("format", file.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).contains("\t\tcall (a);\n");
        assertThat(err.toString()).contains("Formatted: " + file);
    }

    @Test
    void format_dryRun_leavesFileAlone() throws IOException {
        var file = write("Messy.cs", MESSY);

        int exitCode = cli.execute("format", "--dry-run", file.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).isEqualTo(MESSY);
        assertThat(err.toString()).contains("Would format: " + file);
    }

    @Test
    void indentOption_rejectsInvalidValue() throws IOException {
        var file = write("Clean.cs", CLEAN);

        assertThat(cli.execute("check", "--indent", "wide", file.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void threadsOption_rejectsNonPositiveCount() throws IOException {
        var file = write("Clean.cs", CLEAN);

        assertThat(cli.execute("check", "--threads", "0", file.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(cli.execute("format", "--threads", "-3", file.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Thread count must be at least 1: 0")
                                  .doesNotContain("IllegalArgumentException");
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
