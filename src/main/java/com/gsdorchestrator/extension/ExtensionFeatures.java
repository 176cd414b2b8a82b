package com.gsdorchestrator.extension;

/**
 * Enhanced behaviours unlocked by the companion provider. Detection is all-or-nothing, so instances are
 * only ever {@link #ALL} or {@link #NONE}.
 */
public final class ExtensionFeatures {

    public static final ExtensionFeatures ALL = new ExtensionFeatures(true);
    public static final ExtensionFeatures NONE = new ExtensionFeatures(false);

    private final boolean enabled;

    private ExtensionFeatures(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isSemanticClassification() {
        return enabled;
    }

    public boolean isEnhancedDiscovery() {
        return enabled;
    }

    public boolean isEnhancedLifecycle() {
        return enabled;
    }

    public boolean isCustomSkillCreation() {
        return enabled;
    }
}
