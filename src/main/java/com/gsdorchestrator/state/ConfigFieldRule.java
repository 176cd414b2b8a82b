package com.gsdorchestrator.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Constraint on one config field, addressed by dot path ({@code safety.max_files_per_commit}).
 */
public class ConfigFieldRule {

    public enum Type {
        STRING, NUMBER, BOOLEAN, OBJECT;

        boolean matches(JsonNode value) {
            switch (this) {
                case STRING: return value.isTextual();
                case NUMBER: return value.isNumber();
                case BOOLEAN: return value.isBoolean();
                case OBJECT: return value.isObject();
                default: return false;
            }
        }

        String label() {
            return name().toLowerCase();
        }
    }

    private final String path;
    private final Type type;
    private Double min;
    private Double max;
    private Object defaultValue;
    private List<String> validValues;
    private final List<Check> warningChecks = new ArrayList<>();
    private final List<Check> securityChecks = new ArrayList<>();

    public ConfigFieldRule(String path, Type type) {
        this.path = path;
        this.type = type;
    }

    public ConfigFieldRule range(double min, double max) {
        this.min = min;
        this.max = max;
        return this;
    }

    public ConfigFieldRule defaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public ConfigFieldRule oneOf(String... values) {
        this.validValues = List.of(values);
        return this;
    }

    public ConfigFieldRule warnWhen(Predicate<JsonNode> condition, String message) {
        warningChecks.add(new Check(condition, message));
        return this;
    }

    public ConfigFieldRule flagWhen(Predicate<JsonNode> condition, String message) {
        securityChecks.add(new Check(condition, message));
        return this;
    }

    public String getPath() {
        return path;
    }

    public Type getType() {
        return type;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public List<String> getValidValues() {
        return validValues != null ? validValues : Collections.emptyList();
    }

    List<Check> getWarningChecks() {
        return warningChecks;
    }

    List<Check> getSecurityChecks() {
        return securityChecks;
    }

    static final class Check {
        final Predicate<JsonNode> condition;
        final String message;

        Check(Predicate<JsonNode> condition, String message) {
            this.condition = condition;
            this.message = message;
        }
    }
}
