package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstallLocation {
    GLOBAL("global"),
    LOCAL("local");

    private final String value;

    InstallLocation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
