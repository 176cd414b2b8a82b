package com.gsdorchestrator.gates;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GateAction {
    PROCEED("proceed"),
    CONFIRM("confirm"),
    BLOCK("block");

    private final String value;

    GateAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
