package org.pragmatica.monostyle.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Replaces a source file so that it is either untouched or fully rewritten.
final class SourceWriter {
    private static final Logger log = LoggerFactory.getLogger(SourceWriter.class);

    private SourceWriter() {}

    /// Writes the content to a sibling temp file, then renames it over the target.
    static void write(Path target, String content) throws IOException {
        var absolute = target.toAbsolutePath();
        var temp = Files.createTempFile(absolute.getParent(),
                                        "." + absolute.getFileName(),
                                        ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            move(temp, absolute);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic rename not supported for {}, replacing in place", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
