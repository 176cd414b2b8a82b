package com.gsdorchestrator.models;

import java.util.Objects;

/**
 * A team member normalized from either on-disk shape: {@code {agentId, role}} or
 * {@code {name, role, description, tools, model}}.
 */
public class TeamMember {

    private final String agentId;
    private final String role;
    private final String description;
    private final String model;

    public TeamMember(String agentId, String role, String description, String model) {
        this.agentId = agentId;
        this.role = role;
        this.description = description;
        this.model = model;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getRole() {
        return role;
    }

    public String getDescription() {
        return description;
    }

    public String getModel() {
        return model;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TeamMember)) return false;
        TeamMember other = (TeamMember) o;
        return Objects.equals(agentId, other.agentId)
            && Objects.equals(role, other.role)
            && Objects.equals(description, other.description)
            && Objects.equals(model, other.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentId, role, description, model);
    }
}
