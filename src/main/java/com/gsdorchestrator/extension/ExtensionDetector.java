package com.gsdorchestrator.extension;

import com.gsdorchestrator.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tries each probe in order; the first hit decides the detection method. The CLI probe comes first.
 */
public class ExtensionDetector {

    private final List<ExtensionProbe> probes;
    private final AppLogger logger;

    public ExtensionDetector() {
        this(DetectionOverrides.none());
    }

    public ExtensionDetector(DetectionOverrides overrides) {
        this(defaultProbes(overrides != null ? overrides : DetectionOverrides.none()));
    }

    public ExtensionDetector(List<ExtensionProbe> probes) {
        this.probes = List.copyOf(probes);
        this.logger = AppLogger.get();
    }

    public static ExtensionCapabilities detectExtension(DetectionOverrides overrides) {
        return new ExtensionDetector(overrides).detect();
    }

    static List<ExtensionProbe> defaultProbes(DetectionOverrides overrides) {
        List<ExtensionProbe> probes = new ArrayList<>();
        if (overrides.getCliAvailable() != null) {
            probes.add(new FixedProbe(DetectionMethod.CLI_BINARY, overrides.getCliAvailable(),
                overrides.getCliVersion()));
        } else {
            probes.add(new CliBinaryProbe());
        }
        probes.add(overrides.getDistPath() != null
            ? new DistDirectoryProbe(overrides.getDistPath())
            : new DistDirectoryProbe());
        return probes;
    }

    public ExtensionCapabilities detect() {
        for (ExtensionProbe probe : probes) {
            Optional<String> version;
            try {
                version = probe.probe();
            } catch (RuntimeException e) {
                logger.warn("Extension probe " + probe.method().getValue() + " failed: " + e.getMessage());
                continue;
            }
            if (version.isPresent()) {
                logger.info("Extension detected via " + probe.method().getValue() + " (version " + version.get() + ")");
                return ExtensionCapabilities.detected(probe.method(), version.get());
            }
        }
        return ExtensionCapabilities.none();
    }

    /**
     * Probe with a predetermined answer, used for overrides.
     */
    static final class FixedProbe implements ExtensionProbe {
        private final DetectionMethod method;
        private final boolean available;
        private final String version;

        FixedProbe(DetectionMethod method, boolean available, String version) {
            this.method = method;
            this.available = available;
            this.version = version;
        }

        @Override
        public DetectionMethod method() {
            return method;
        }

        @Override
        public Optional<String> probe() {
            if (!available) {
                return Optional.empty();
            }
            return Optional.of(version != null ? version : "unknown");
        }
    }
}
