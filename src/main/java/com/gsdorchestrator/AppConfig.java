package com.gsdorchestrator;

import com.gsdorchestrator.gates.OperatingMode;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Application configuration: where the installation and planning directory live, the HTTP port and
 * the operating mode.
 */
public class AppConfig {

    private static final String APP_NAME = "GSD-Orchestrator";
    public static final int DEFAULT_PORT = 7070;

    private final Path basePath;
    private final Path planningPath;
    private final Path logPath;
    private final int port;
    private final OperatingMode mode;
    private final boolean semantic;
    private final boolean devMode;

    private AppConfig(Path basePath, Path planningPath, Path logPath, int port, OperatingMode mode,
                      boolean semantic, boolean devMode) {
        this.basePath = basePath;
        this.planningPath = planningPath;
        this.logPath = logPath;
        this.port = port;
        this.mode = mode;
        this.semantic = semantic;
        this.devMode = devMode;
    }

    /**
     * Installation base directory, or null to auto-detect one.
     */
    public Path getBasePath() {
        return basePath;
    }

    public Path getPlanningPath() {
        return planningPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public OperatingMode getMode() {
        return mode;
    }

    public boolean isSemantic() {
        return semantic;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public static Path getDefaultPlanningPath() {
        return Paths.get(System.getProperty("user.dir"), ".planning");
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\GSD-Orchestrator\logs
     * macOS: ~/Library/Logs/GSD-Orchestrator
     * Linux: ~/.local/share/GSD-Orchestrator/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("gsd-orchestrator.log");
    }

    /**
     * The preferred port when free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail on start with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig. Both {@code --name=value} and {@code --name value} forms are accepted.
     */
    public static class Builder {
        private Path basePath = null;
        private Path planningPath = null;
        private int preferredPort = DEFAULT_PORT;
        private OperatingMode mode = OperatingMode.INTERACTIVE;
        private boolean semantic = false;
        private boolean devMode = false;

        public Builder basePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.basePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder planningPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.planningPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.preferredPort = port;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = OperatingMode.fromValue(mode);
            return this;
        }

        public Builder semantic(boolean semantic) {
            this.semantic = semantic;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--base=")) {
                    basePath(arg.substring("--base=".length()));
                } else if ("--base".equals(arg) && i + 1 < args.length) {
                    basePath(args[++i]);
                } else if (arg.startsWith("--planning=")) {
                    planningPath(arg.substring("--planning=".length()));
                } else if ("--planning".equals(arg) && i + 1 < args.length) {
                    planningPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    port(parsePort(arg.substring("--port=".length())));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    port(parsePort(args[++i]));
                } else if (arg.startsWith("--mode=")) {
                    mode(arg.substring("--mode=".length()));
                } else if ("--mode".equals(arg) && i + 1 < args.length) {
                    mode(args[++i]);
                } else if ("--semantic".equals(arg)) {
                    this.semantic = true;
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private static int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }

        /**
         * Resolves defaults without touching the network or the log directory.
         */
        AppConfig buildDetached() {
            Path planning = planningPath != null ? planningPath : getDefaultPlanningPath();
            return new AppConfig(basePath, planning, getLogFilePath(), preferredPort, mode, semantic, devMode);
        }

        public AppConfig build() throws IOException {
            Path planning = planningPath != null ? planningPath : getDefaultPlanningPath();
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(basePath, planning, logPath, port, mode, semantic, devMode);
        }
    }
}
