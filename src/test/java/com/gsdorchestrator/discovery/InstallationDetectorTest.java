package com.gsdorchestrator.discovery;

import com.gsdorchestrator.models.InstallLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InstallationDetectorTest {

    @TempDir
    Path root;

    private Path install(String name) throws IOException {
        Path base = root.resolve(name);
        Path version = GsdDiscoveryService.versionFile(base);
        Files.createDirectories(version.getParent());
        Files.writeString(version, "1.12.1");
        return base;
    }

    @Test
    void globalInstallationWins() throws IOException {
        Path global = install("home");
        Path local = install("project");
        GsdInstallation found = new InstallationDetector(global, local).detect();
        assertNotNull(found);
        assertEquals(global, found.getBasePath());
        assertEquals(InstallLocation.GLOBAL, found.getLocation());
    }

    @Test
    void fallsBackToLocal() throws IOException {
        Path local = install("project");
        GsdInstallation found = new InstallationDetector(root.resolve("home"), local).detect();
        assertNotNull(found);
        assertEquals(InstallLocation.LOCAL, found.getLocation());
    }

    @Test
    void directoryWithoutVersionMarkerIsNotAnInstallation() throws IOException {
        Files.createDirectories(root.resolve("home/commands/gsd"));
        assertNull(new InstallationDetector(root.resolve("home"), root.resolve("project")).detect());
        assertNull(GsdDiscoveryService.create(new InstallationDetector(root.resolve("home"), root.resolve("project"))));
    }
}
