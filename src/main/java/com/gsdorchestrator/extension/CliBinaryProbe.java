package com.gsdorchestrator.extension;

import com.gsdorchestrator.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs {@code <binary> --version} and looks for a semantic version in its output.
 */
public class CliBinaryProbe implements ExtensionProbe {

    public static final String DEFAULT_BINARY = "skill-creator";
    public static final long DEFAULT_TIMEOUT_MS = 3000;

    private static final Pattern SEMVER = Pattern.compile("(\\d+\\.\\d+\\.\\d+(?:-[0-9A-Za-z.-]+)?)");

    private final String binary;
    private final long timeoutMs;
    private final AppLogger logger;

    public CliBinaryProbe() {
        this(defaultBinary(System.getProperty("os.name", "")), DEFAULT_TIMEOUT_MS);
    }

    public CliBinaryProbe(String binary, long timeoutMs) {
        this.binary = binary;
        this.timeoutMs = timeoutMs;
        this.logger = AppLogger.get();
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.CLI_BINARY;
    }

    @Override
    public Optional<String> probe() {
        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("extension-probe", ".out");
            List<String> command = new ArrayList<>();
            command.add(binary);
            command.add("--version");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            process = pb.start();

            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Extension CLI '" + binary + "' did not answer within " + timeoutMs + "ms");
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                return Optional.empty();
            }
            return parseVersion(Files.readString(output, StandardCharsets.UTF_8));
        } catch (IOException e) {
            // Binary not on PATH is the common case.
            logger.info("Extension CLI '" + binary + "' not available: " + e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    /**
     * npm installs a {@code .cmd} shim on Windows, and ProcessBuilder does not resolve it without the extension.
     */
    static String defaultBinary(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return DEFAULT_BINARY + ".cmd";
        }
        return DEFAULT_BINARY;
    }

    static Optional<String> parseVersion(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = SEMVER.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete probe output " + file + ": " + e.getMessage());
        }
    }
}
