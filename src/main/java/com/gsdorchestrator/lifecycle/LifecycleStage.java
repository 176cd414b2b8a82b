package com.gsdorchestrator.lifecycle;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse label for where a project currently stands.
 */
public enum LifecycleStage {
    UNINITIALIZED("uninitialized"),
    INITIALIZED("initialized"),
    ROADMAPPED("roadmapped"),
    PLANNING("planning"),
    EXECUTING("executing"),
    VERIFYING("verifying"),
    MILESTONE_END("milestone-end"),
    BETWEEN_PHASES("between-phases");

    private final String value;

    LifecycleStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Stages that are resolved from project-level facts alone, without scanning a phase directory.
     */
    public boolean isStageLevel() {
        return this == UNINITIALIZED || this == INITIALIZED || this == MILESTONE_END || this == BETWEEN_PHASES;
    }

    public static LifecycleStage fromValue(String value) {
        for (LifecycleStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle stage: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
