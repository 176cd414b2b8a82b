package com.gsdorchestrator.models;

import java.util.Objects;

public class AgentSpec {

    private final String name;
    private final String description;
    private final String tools;
    private final String model;
    private final String color;
    private final String filePath;

    public AgentSpec(String name, String description, String tools, String model, String color, String filePath) {
        this.name = name;
        this.description = description;
        this.tools = tools;
        this.model = model;
        this.color = color;
        this.filePath = filePath;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Raw comma separated tool list as written in the agent header.
     */
    public String getTools() {
        return tools;
    }

    public String getModel() {
        return model;
    }

    public String getColor() {
        return color;
    }

    public String getFilePath() {
        return filePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentSpec)) return false;
        AgentSpec other = (AgentSpec) o;
        return Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(tools, other.tools)
            && Objects.equals(model, other.model)
            && Objects.equals(color, other.color)
            && Objects.equals(filePath, other.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, tools, model, color, filePath);
    }

    @Override
    public String toString() {
        return "AgentSpec{" + name + "}";
    }
}
