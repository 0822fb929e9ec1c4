package org.pragmatica.monostyle.shared;

import java.nio.file.Path;

/// Reasons an input is rejected before it reaches the pipeline.
public sealed interface InputError {
    Path path();

    String message();

    /// Bytes are not valid UTF-8.
    record MalformedEncoding(Path path, String detail) implements InputError {
        @Override
        public String message() {
            return "Not valid UTF-8 text: " + path + " (" + detail + ")";
        }
    }

    /// File contains NUL bytes and is treated as binary.
    record BinaryContent(Path path) implements InputError {
        @Override
        public String message() {
            return "Binary content rejected: " + path;
        }
    }

    /// File could not be read at all.
    record Unreadable(Path path, String reason) implements InputError {
        @Override
        public String message() {
            return "Cannot read " + path + ": " + reason;
        }
    }
}
