package com.gsdorchestrator.gates;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code interactive} asks before risky steps; {@code yolo} is the fast, non-interactive mode.
 */
public enum OperatingMode {
    INTERACTIVE("interactive"),
    YOLO("yolo");

    private final String value;

    OperatingMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown or missing values resolve to {@link #INTERACTIVE}.
     */
    public static OperatingMode fromValue(String value) {
        if (value != null && YOLO.value.equalsIgnoreCase(value.trim())) {
            return YOLO;
        }
        return INTERACTIVE;
    }
}
