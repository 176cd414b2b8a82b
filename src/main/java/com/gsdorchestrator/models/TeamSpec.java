package com.gsdorchestrator.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class TeamSpec {

    private final String name;
    private final String description;
    private final String topology;
    private final String leadAgentId;
    private final List<TeamMember> members;
    private final String configPath;

    public TeamSpec(String name, String description, String topology, String leadAgentId,
                    List<TeamMember> members, String configPath) {
        this.name = name;
        this.description = description;
        this.topology = topology;
        this.leadAgentId = leadAgentId;
        this.members = members != null ? List.copyOf(members) : Collections.emptyList();
        this.configPath = configPath;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getTopology() {
        return topology;
    }

    public String getLeadAgentId() {
        return leadAgentId;
    }

    public List<TeamMember> getMembers() {
        return members;
    }

    public int getMemberCount() {
        return members.size();
    }

    public String getConfigPath() {
        return configPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TeamSpec)) return false;
        TeamSpec other = (TeamSpec) o;
        return Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(topology, other.topology)
            && Objects.equals(leadAgentId, other.leadAgentId)
            && members.equals(other.members)
            && Objects.equals(configPath, other.configPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, topology, leadAgentId, members, configPath);
    }
}
