package com.gsdorchestrator.intent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gsdorchestrator.lifecycle.LifecycleStage;
import com.gsdorchestrator.models.CommandSpec;

import java.util.List;

public class ClassificationResult {

    private final ClassificationType type;
    private final CommandSpec command;
    private final double confidence;
    private final ExtractedArguments arguments;
    private final ClassificationMethod method;
    private final List<CommandScore> alternatives;
    private final LifecycleStage lifecycleStage;
    private final String message;

    public ClassificationResult(ClassificationType type, CommandSpec command, double confidence,
                                ExtractedArguments arguments, ClassificationMethod method,
                                List<CommandScore> alternatives, LifecycleStage lifecycleStage, String message) {
        this.type = type;
        this.command = command;
        this.confidence = confidence;
        this.arguments = arguments;
        this.method = method;
        this.alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        this.lifecycleStage = lifecycleStage;
        this.message = message;
    }

    public static ClassificationResult error(String query, String message) {
        return new ClassificationResult(ClassificationType.ERROR, null, 0.0, ExtractedArguments.empty(query),
            null, null, null, message);
    }

    public ClassificationType getType() {
        return type;
    }

    public CommandSpec getCommand() {
        return command;
    }

    public double getConfidence() {
        return confidence;
    }

    public ExtractedArguments getArguments() {
        return arguments;
    }

    public ClassificationMethod getMethod() {
        return method;
    }

    public List<CommandScore> getAlternatives() {
        return alternatives;
    }

    public LifecycleStage getLifecycleStage() {
        return lifecycleStage;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getMessage() {
        return message;
    }

    /**
     * Name of the resolved command, or null when nothing was resolved.
     */
    public String commandName() {
        return command != null ? command.getName() : null;
    }
}
