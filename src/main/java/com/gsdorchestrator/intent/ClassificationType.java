package com.gsdorchestrator.intent;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationType {
    EXACT_MATCH("exact-match"),
    CLASSIFIED("classified"),
    AMBIGUOUS("ambiguous"),
    ERROR("error");

    private final String value;

    ClassificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
