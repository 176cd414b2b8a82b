package com.gsdorchestrator.extension;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    CLI_BINARY("cli-binary"),
    DIST_DIRECTORY("dist-directory"),
    NONE("none");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
