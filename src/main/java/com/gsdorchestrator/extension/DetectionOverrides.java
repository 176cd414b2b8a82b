package com.gsdorchestrator.extension;

import java.nio.file.Path;

/**
 * Forces probe outcomes without touching the environment. Unset fields fall back to real probing.
 */
public class DetectionOverrides {

    private Boolean cliAvailable;
    private String cliVersion;
    private Path distPath;

    public static DetectionOverrides none() {
        return new DetectionOverrides();
    }

    public DetectionOverrides cliAvailable(boolean available) {
        this.cliAvailable = available;
        return this;
    }

    public DetectionOverrides cliVersion(String version) {
        this.cliVersion = version;
        return this;
    }

    public DetectionOverrides distPath(Path path) {
        this.distPath = path;
        return this;
    }

    public Boolean getCliAvailable() {
        return cliAvailable;
    }

    public String getCliVersion() {
        return cliVersion;
    }

    public Path getDistPath() {
        return distPath;
    }
}
