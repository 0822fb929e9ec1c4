package org.pragmatica.monostyle.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Utility for collecting C# source files from paths.
 */
public final class FileCollector {

    private static final String EXTENSION = ".cs";

    private FileCollector() {}

    /**
     * Collect C# files from a list of paths (files or directories).
     * Directories are scanned recursively; explicitly named files are taken whatever their extension.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of source file paths, sorted within each directory
     */
    public static List<Path> collectSourceFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();
        for (var path : paths) {
            if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                errorHandler.accept("No such file or directory: " + path);
            }
        }
        return files;
    }

    private static void collectFromDirectory(Path directory, List<Path> files, Consumer<String> errorHandler) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                .filter(path -> path.getFileName()
                                    .toString()
                                    .endsWith(EXTENSION))
                .sorted()
                .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            errorHandler.accept("Error scanning " + directory + ": " + e.getMessage());
        }
    }
}
