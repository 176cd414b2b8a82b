package com.gsdorchestrator.extension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Looks for the provider's installed package directory. The version comes from the sibling
 * {@code package.json} when there is one.
 */
public class DistDirectoryProbe implements ExtensionProbe {

    public static final String PACKAGE_NAME = "gsd-skill-creator";

    private final Path distPath;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public DistDirectoryProbe() {
        this(defaultDistPath());
    }

    public DistDirectoryProbe(Path distPath) {
        this.distPath = distPath;
        this.objectMapper = new ObjectMapper();
        this.logger = AppLogger.get();
    }

    public static Path defaultDistPath() {
        return Paths.get(System.getProperty("user.dir"), "node_modules", PACKAGE_NAME, "dist");
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.DIST_DIRECTORY;
    }

    @Override
    public Optional<String> probe() {
        if (distPath == null || !Files.isDirectory(distPath)) {
            return Optional.empty();
        }
        return Optional.of(readPackageVersion().orElse("unknown"));
    }

    private Optional<String> readPackageVersion() {
        Path parent = distPath.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        Path packageJson = parent.resolve("package.json");
        if (!Files.isRegularFile(packageJson)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(packageJson.toFile());
            JsonNode version = node != null ? node.get("version") : null;
            return version != null && version.isTextual() ? Optional.of(version.asText()) : Optional.empty();
        } catch (IOException e) {
            logger.warn("Failed to read " + packageJson + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
