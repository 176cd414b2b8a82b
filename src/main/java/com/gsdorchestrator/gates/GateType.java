package com.gsdorchestrator.gates;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GateType {
    ROUTING("routing"),
    DESTRUCTIVE("destructive"),
    LOW_CONFIDENCE("low-confidence");

    private final String value;

    GateType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
