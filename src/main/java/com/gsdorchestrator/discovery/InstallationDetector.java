package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.InstallLocation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates an installation by its version marker: the user-level {@code ~/.claude} directory wins over the
 * project-level {@code ./.claude} directory.
 */
public class InstallationDetector {

    private final Path globalBase;
    private final Path localBase;

    public InstallationDetector() {
        this(defaultGlobalBase(), defaultLocalBase());
    }

    public InstallationDetector(Path globalBase, Path localBase) {
        this.globalBase = globalBase != null ? globalBase : defaultGlobalBase();
        this.localBase = localBase != null ? localBase : defaultLocalBase();
    }

    public static Path defaultGlobalBase() {
        return Paths.get(System.getProperty("user.home"), ".claude");
    }

    public static Path defaultLocalBase() {
        return Paths.get(System.getProperty("user.dir"), ".claude");
    }

    public GsdInstallation detect() {
        if (hasVersionMarker(globalBase)) {
            return new GsdInstallation(globalBase, InstallLocation.GLOBAL);
        }
        if (hasVersionMarker(localBase)) {
            return new GsdInstallation(localBase, InstallLocation.LOCAL);
        }
        return null;
    }

    private static boolean hasVersionMarker(Path base) {
        return Files.isRegularFile(GsdDiscoveryService.versionFile(base));
    }
}
