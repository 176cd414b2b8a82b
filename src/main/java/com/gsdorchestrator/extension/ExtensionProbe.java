package com.gsdorchestrator.extension;

import java.util.Optional;

/**
 * One way of finding the companion provider. Implementations must not throw; a failed probe is empty.
 */
public interface ExtensionProbe {

    DetectionMethod method();

    /**
     * @return the detected version (possibly {@code "unknown"}), or empty when not found
     */
    Optional<String> probe();
}
