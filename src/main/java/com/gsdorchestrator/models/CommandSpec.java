package com.gsdorchestrator.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One discovered command, parsed from {@code commands/<namespace>/<verb>.md}.
 */
public class CommandSpec {

    private final String name;
    private final String description;
    private final String argumentHint;
    private final List<String> allowedTools;
    private final String agent;
    private final String objective;
    private final String filePath;

    public CommandSpec(String name, String description, String argumentHint, List<String> allowedTools,
                       String agent, String objective, String filePath) {
        this.name = name;
        this.description = description;
        this.argumentHint = argumentHint;
        this.allowedTools = allowedTools != null ? List.copyOf(allowedTools) : Collections.emptyList();
        this.agent = agent;
        this.objective = objective;
        this.filePath = filePath;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getArgumentHint() {
        return argumentHint;
    }

    public List<String> getAllowedTools() {
        return allowedTools;
    }

    public String getAgent() {
        return agent;
    }

    public String getObjective() {
        return objective;
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * The part after the namespace separator, e.g. {@code plan-phase} for {@code gsd:plan-phase}.
     */
    public String verb() {
        int idx = name.indexOf(':');
        return idx >= 0 ? name.substring(idx + 1) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandSpec)) return false;
        CommandSpec other = (CommandSpec) o;
        return Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(argumentHint, other.argumentHint)
            && allowedTools.equals(other.allowedTools)
            && Objects.equals(agent, other.agent)
            && Objects.equals(objective, other.objective)
            && Objects.equals(filePath, other.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, argumentHint, allowedTools, agent, objective, filePath);
    }

    @Override
    public String toString() {
        return "CommandSpec{" + name + "}";
    }
}
