package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.InstallLocation;

import java.nio.file.Path;

public class GsdInstallation {

    private final Path basePath;
    private final InstallLocation location;

    public GsdInstallation(Path basePath, InstallLocation location) {
        this.basePath = basePath;
        this.location = location;
    }

    public Path getBasePath() {
        return basePath;
    }

    public InstallLocation getLocation() {
        return location;
    }
}
