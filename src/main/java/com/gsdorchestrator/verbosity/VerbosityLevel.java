package com.gsdorchestrator.verbosity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VerbosityLevel {
    SILENT(1),
    MINIMAL(2),
    STANDARD(3),
    DETAILED(4),
    TRANSPARENT(5);

    public static final VerbosityLevel DEFAULT = STANDARD;

    private final int value;

    VerbosityLevel(int value) {
        this.value = value;
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    public static VerbosityLevel fromValue(int value) {
        for (VerbosityLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new IllegalArgumentException("Verbosity level must be an integer from 1 to 5, got " + value);
    }

    /**
     * Parse a raw setting. Null means the default; anything other than an integer 1-5 is rejected.
     */
    public static VerbosityLevel parse(Object raw) {
        if (raw == null) {
            return DEFAULT;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return fromValue(((Number) raw).intValue());
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (d == Math.rint(d)) {
                return fromValue((int) d);
            }
        }
        throw new IllegalArgumentException("Verbosity level must be an integer from 1 to 5, got " + raw);
    }
}
