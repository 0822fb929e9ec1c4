package org.pragmatica.monostyle.cli;

import org.pragmatica.monostyle.shared.InputError;
import org.pragmatica.monostyle.shared.InvalidSourceException;
import org.pragmatica.monostyle.shared.SourceFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/// Reads and validates files before they enter the pipeline.
final class SourceLoader {
    private SourceLoader() {}

    static List<SourceFile> load(List<Path> paths, Consumer<InputError> rejected) {
        var sources = new ArrayList<SourceFile>(paths.size());
        for (var path : paths) {
            try {
                sources.add(read(path));
            } catch (InvalidSourceException e) {
                rejected.accept(e.error());
            }
        }
        return sources;
    }

    static SourceFile read(Path path) throws InvalidSourceException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new InvalidSourceException(new InputError.Unreadable(path, e.getMessage()));
        }
        return SourceFile.decode(path, bytes);
    }
}
