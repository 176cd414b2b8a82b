package com.gsdorchestrator;

import com.gsdorchestrator.gates.OperatingMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaults() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[0]).buildDetached();
        assertNull(config.getBasePath());
        assertEquals(AppConfig.getDefaultPlanningPath(), config.getPlanningPath());
        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
        assertEquals(OperatingMode.INTERACTIVE, config.getMode());
        assertFalse(config.isSemantic());
        assertFalse(config.isDevMode());
        assertTrue(config.getLogPath().endsWith("gsd-orchestrator.log"));
    }

    @Test
    void parsesBothArgumentForms() {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[]{"--base=/opt/claude", "--planning", "/work/.planning", "--port", "8088",
                "--mode=yolo", "--semantic", "--dev", "--unknown"})
            .buildDetached();
        assertEquals(Paths.get("/opt/claude").toAbsolutePath().normalize(), config.getBasePath());
        assertEquals(Paths.get("/work/.planning").toAbsolutePath().normalize(), config.getPlanningPath());
        assertEquals(8088, config.getPort());
        assertEquals(OperatingMode.YOLO, config.getMode());
        assertTrue(config.isSemantic());
        assertTrue(config.isDevMode());
    }

    @Test
    void invalidPortIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--port=abc"}));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--port", "70000"}));
    }

    @Test
    void unknownModeFallsBackToInteractive() {
        AppConfig config = new AppConfig.Builder().mode("turbo").buildDetached();
        assertEquals(OperatingMode.INTERACTIVE, config.getMode());
    }

    @Test
    void trailingFlagWithoutValueIsIgnored() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[]{"--port"}).buildDetached();
        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
    }
}
