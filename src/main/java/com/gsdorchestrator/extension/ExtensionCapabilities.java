package com.gsdorchestrator.extension;

public class ExtensionCapabilities {

    private static final ExtensionCapabilities NONE =
        new ExtensionCapabilities(false, DetectionMethod.NONE, null);

    private final boolean detected;
    private final DetectionMethod detectionMethod;
    private final String version;
    private final ExtensionFeatures features;

    private ExtensionCapabilities(boolean detected, DetectionMethod detectionMethod, String version) {
        this.detected = detected;
        this.detectionMethod = detectionMethod;
        this.version = version;
        this.features = detected ? ExtensionFeatures.ALL : ExtensionFeatures.NONE;
    }

    public static ExtensionCapabilities detected(DetectionMethod method, String version) {
        return new ExtensionCapabilities(true, method, version);
    }

    /**
     * Canonical "nothing installed" value: not detected, method {@code none}, every feature off.
     */
    public static ExtensionCapabilities none() {
        return NONE;
    }

    public boolean isDetected() {
        return detected;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public String getVersion() {
        return version;
    }

    public ExtensionFeatures getFeatures() {
        return features;
    }
}
