package com.gsdorchestrator.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory listing helpers. A missing directory lists as empty; results are sorted by name so that
 * discovery output does not depend on filesystem ordering.
 */
final class DirectoryScanner {

    private DirectoryScanner() {
    }

    static List<Path> listFiles(Path dir, String extension) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(extension))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    static List<Path> listDirectories(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isDirectory)
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
