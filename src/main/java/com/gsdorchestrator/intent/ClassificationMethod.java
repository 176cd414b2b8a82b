package com.gsdorchestrator.intent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which layer produced a result.
 */
public enum ClassificationMethod {
    EXACT("exact"),
    BAYES("bayes"),
    SEMANTIC("semantic");

    private final String value;

    ClassificationMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
