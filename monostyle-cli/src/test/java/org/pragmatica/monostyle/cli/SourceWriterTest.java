package org.pragmatica.monostyle.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceWriterTest {

    @TempDir
    Path dir;

    @Test
    void write_replacesContentAndLeavesNoTempFile() throws IOException {
        var target = Files.writeString(dir.resolve("Sample.cs"), "class A{}\n");

        SourceWriter.write(target, "class A {}\n// ü\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("class A {}\n// ü\n");
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void write_failure_leavesTargetDirectoryUntouched() {
        var target = dir.resolve("missing")
                        .resolve("Sample.cs");

        assertThatThrownBy(() -> SourceWriter.write(target, "class A {}\n")).isInstanceOf(IOException.class);
        assertThat(dir.resolve("missing")).doesNotExist();
    }
}
