package org.pragmatica.monostyle.format;

import org.pragmatica.monostyle.shared.SourceFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Golden tests: files under format-examples are already in house style, so checking them must find
 * nothing and formatting them must leave them byte-for-byte unchanged.
 */
class GoldenFormatterTest {

    private static final Path EXAMPLES_DIR = Path.of("src/test/resources/format-examples");

    private final StyleFormatter formatter = StyleFormatter.styleFormatter();

    @ParameterizedTest
    @ValueSource(strings = {"Warehouse.cs", "Repository.cs", "SettingsController.cs"})
    void goldenFile_hasNoFindings(String fileName) throws IOException {
        var source = load(fileName);

        assertThat(formatter.check(source)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Warehouse.cs", "Repository.cs", "SettingsController.cs"})
    void goldenFile_isUnchangedByFormatting(String fileName) throws IOException {
        var source = load(fileName);

        var result = formatter.format(source);

        assertThat(result.source()
                         .content()).isEqualTo(source.content());
        assertThat(result.appliedCount()).isZero();
    }

    private static SourceFile load(String fileName) throws IOException {
        var path = EXAMPLES_DIR.resolve(fileName);
        return SourceFile.sourceFile(path, Files.readString(path));
    }
}
