package com.gsdorchestrator.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks a raw config object against the field registry. Defaults are never applied here: a field that is
 * present with the wrong type or out of range is an error even though {@link ConfigParser} would quietly
 * fall back for it. Absent fields are not checked.
 */
public class ConfigValidator {

    public static final String SEVERITY_ERROR = "error";
    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_SECURITY = "security";

    private final ObjectMapper objectMapper;
    private final List<ConfigFieldRule> rules;

    public ConfigValidator(ObjectMapper objectMapper) {
        this(objectMapper, defaultRules());
    }

    public ConfigValidator(ObjectMapper objectMapper, List<ConfigFieldRule> rules) {
        this.objectMapper = objectMapper;
        this.rules = List.copyOf(rules);
    }

    public static List<ConfigFieldRule> defaultRules() {
        List<ConfigFieldRule> rules = new ArrayList<>();
        rules.add(new ConfigFieldRule("mode", ConfigFieldRule.Type.STRING)
            .defaultValue("interactive")
            .oneOf("interactive", "yolo")
            .flagWhen(v -> "yolo".equals(v.asText()),
                "Mode \"yolo\" skips confirmations, so user actions are not verified before execution"));
        rules.add(new ConfigFieldRule("verbosity", ConfigFieldRule.Type.NUMBER)
            .range(1, 5).defaultValue(3));
        rules.add(new ConfigFieldRule("depth", ConfigFieldRule.Type.STRING)
            .defaultValue("standard").oneOf("quick", "standard", "comprehensive"));
        rules.add(new ConfigFieldRule("model_profile", ConfigFieldRule.Type.STRING)
            .defaultValue("balanced").oneOf("quality", "balanced", "budget"));

        rules.add(new ConfigFieldRule("safety.max_files_per_commit", ConfigFieldRule.Type.NUMBER)
            .range(1, 100).defaultValue(20)
            .warnWhen(v -> v.asDouble() > 50, "Large commits are harder to review and revert")
            .flagWhen(v -> v.asDouble() > 50, "Very high file limit per commit increases risk of unreviewed changes"));
        rules.add(new ConfigFieldRule("safety.require_tests", ConfigFieldRule.Type.BOOLEAN)
            .defaultValue(true)
            .flagWhen(v -> !v.asBoolean(), "Disabling test requirements may allow broken code"));

        rules.add(new ConfigFieldRule("gates.require_plan_approval", ConfigFieldRule.Type.BOOLEAN)
            .defaultValue(false));
        rules.add(new ConfigFieldRule("gates.require_checkpoint_approval", ConfigFieldRule.Type.BOOLEAN)
            .defaultValue(true)
            .flagWhen(v -> !v.asBoolean(), "Disabling checkpoint approval removes human verification of critical steps"));

        rules.add(new ConfigFieldRule("parallelization.max_parallel", ConfigFieldRule.Type.NUMBER)
            .range(1, 10)
            .warnWhen(v -> v.asDouble() > 5, "High parallelism may cause file conflicts"));

        rules.add(new ConfigFieldRule("contextWindowSize", ConfigFieldRule.Type.NUMBER)
            .range(1000, 2_000_000).defaultValue(200_000));
        rules.add(new ConfigFieldRule("budgetPercent", ConfigFieldRule.Type.NUMBER)
            .range(0.01, 0.20).defaultValue(0.03)
            .warnWhen(v -> v.asDouble() > 0.10, "Budget above 10% consumes significant context"));
        rules.add(new ConfigFieldRule("relevanceThreshold", ConfigFieldRule.Type.NUMBER)
            .range(0.0, 1.0).defaultValue(0.1)
            .warnWhen(v -> v.asDouble() < 0.05, "Very low threshold: nearly all skills will activate")
            .warnWhen(v -> v.asDouble() > 0.9, "Very high threshold: most skills will never activate"));
        rules.add(new ConfigFieldRule("maxSkillsPerSession", ConfigFieldRule.Type.NUMBER)
            .range(1, 20).defaultValue(5));
        rules.add(new ConfigFieldRule("hardCeilingPercent", ConfigFieldRule.Type.NUMBER)
            .range(0.01, 0.30));
        return rules;
    }

    /**
     * Validate raw JSON text. Unparseable text is reported as a {@code (root)} error.
     */
    public ValidationResult validate(String json) {
        if (json == null || json.isBlank()) {
            return rootError(null, "Config must be a plain object, got nothing");
        }
        try {
            return validate(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            return rootError(json, "Config is not valid JSON: " + e.getOriginalMessage());
        }
    }

    public ValidationResult validate(JsonNode raw) {
        if (raw == null || raw.isMissingNode() || !raw.isObject()) {
            Object current = raw == null || raw.isMissingNode() ? null : objectMapper.convertValue(raw, Object.class);
            return rootError(current,
                "Config must be a plain object, got " + describe(raw));
        }

        List<ConfigIssue> errors = new ArrayList<>();
        List<ConfigIssue> warnings = new ArrayList<>();
        List<ConfigIssue> securityIssues = new ArrayList<>();

        for (ConfigFieldRule rule : rules) {
            JsonNode value = lookup(raw, rule.getPath());
            if (value == null) {
                continue;
            }
            Object current = objectMapper.convertValue(value, Object.class);
            ExpectedRange expected = ExpectedRange.of(rule);

            if (!rule.getType().matches(value)) {
                errors.add(new ConfigIssue(rule.getPath(),
                    "Type mismatch: expected " + rule.getType().label() + ", got " + describe(value),
                    SEVERITY_ERROR, current, expected));
                continue;
            }
            if (!rule.getValidValues().isEmpty() && !rule.getValidValues().contains(value.asText())) {
                errors.add(new ConfigIssue(rule.getPath(),
                    "Invalid value \"" + value.asText() + "\": must be one of " + String.join(", ", rule.getValidValues()),
                    SEVERITY_ERROR, current, expected));
                continue;
            }
            if (value.isNumber()) {
                double number = value.asDouble();
                if (rule.getMin() != null && number < rule.getMin()) {
                    errors.add(new ConfigIssue(rule.getPath(),
                        "Value " + value.asText() + " is below minimum " + format(rule.getMin()),
                        SEVERITY_ERROR, current, expected));
                    continue;
                }
                if (rule.getMax() != null && number > rule.getMax()) {
                    errors.add(new ConfigIssue(rule.getPath(),
                        "Value " + value.asText() + " is above maximum " + format(rule.getMax()),
                        SEVERITY_ERROR, current, expected));
                    continue;
                }
            }
            for (ConfigFieldRule.Check check : rule.getWarningChecks()) {
                if (check.condition.test(value)) {
                    warnings.add(new ConfigIssue(rule.getPath(), check.message, SEVERITY_WARNING, current, expected));
                }
            }
            for (ConfigFieldRule.Check check : rule.getSecurityChecks()) {
                if (check.condition.test(value)) {
                    securityIssues.add(new ConfigIssue(rule.getPath(), check.message, SEVERITY_SECURITY, current, expected));
                }
            }
        }

        return new ValidationResult(errors, warnings, securityIssues);
    }

    private static JsonNode lookup(JsonNode root, String path) {
        JsonNode current = root;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "null";
        if (node.isArray()) return "array";
        if (node.isTextual()) return "string";
        if (node.isNumber()) return "number";
        if (node.isBoolean()) return "boolean";
        return "object";
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static ValidationResult rootError(Object current, String message) {
        ConfigIssue issue = new ConfigIssue("(root)", message, SEVERITY_ERROR, current, null);
        return new ValidationResult(List.of(issue), Collections.emptyList(), Collections.emptyList());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConfigIssue {
        private final String field;
        private final String message;
        private final String severity;
        private final Object currentValue;
        private final ExpectedRange expectedRange;

        public ConfigIssue(String field, String message, String severity, Object currentValue, ExpectedRange expectedRange) {
            this.field = field;
            this.message = message;
            this.severity = severity;
            this.currentValue = currentValue;
            this.expectedRange = expectedRange;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        public String getSeverity() {
            return severity;
        }

        public Object getCurrentValue() {
            return currentValue;
        }

        public ExpectedRange getExpectedRange() {
            return expectedRange;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ExpectedRange {
        private final Double min;
        private final Double max;
        private final Object defaultValue;
        private final List<String> validValues;

        ExpectedRange(Double min, Double max, Object defaultValue, List<String> validValues) {
            this.min = min;
            this.max = max;
            this.defaultValue = defaultValue;
            this.validValues = validValues;
        }

        static ExpectedRange of(ConfigFieldRule rule) {
            return new ExpectedRange(rule.getMin(), rule.getMax(), rule.getDefaultValue(), rule.getValidValues());
        }

        public Double getMin() {
            return min;
        }

        public Double getMax() {
            return max;
        }

        @JsonProperty("default")
        public Object getDefaultValue() {
            return defaultValue;
        }

        public List<String> getValidValues() {
            return validValues;
        }
    }

    public static class ValidationResult {
        private final List<ConfigIssue> errors;
        private final List<ConfigIssue> warnings;
        private final List<ConfigIssue> securityIssues;

        public ValidationResult(List<ConfigIssue> errors, List<ConfigIssue> warnings, List<ConfigIssue> securityIssues) {
            this.errors = List.copyOf(errors);
            this.warnings = List.copyOf(warnings);
            this.securityIssues = List.copyOf(securityIssues);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<ConfigIssue> getErrors() {
            return errors;
        }

        public List<ConfigIssue> getWarnings() {
            return warnings;
        }

        public List<ConfigIssue> getSecurityIssues() {
            return securityIssues;
        }
    }
}
