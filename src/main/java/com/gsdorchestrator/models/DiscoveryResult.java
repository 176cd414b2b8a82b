package com.gsdorchestrator.models;

import java.util.Collections;
import java.util.List;

public class DiscoveryResult {

    private final List<CommandSpec> commands;
    private final List<AgentSpec> agents;
    private final List<TeamSpec> teams;
    private final String basePath;
    private final InstallLocation location;
    private final String version;
    private final long discoveredAt;

    public DiscoveryResult(List<CommandSpec> commands, List<AgentSpec> agents, List<TeamSpec> teams,
                           String basePath, InstallLocation location, String version, long discoveredAt) {
        this.commands = commands != null ? List.copyOf(commands) : Collections.emptyList();
        this.agents = agents != null ? List.copyOf(agents) : Collections.emptyList();
        this.teams = teams != null ? List.copyOf(teams) : Collections.emptyList();
        this.basePath = basePath;
        this.location = location;
        this.version = version;
        this.discoveredAt = discoveredAt;
    }

    public List<CommandSpec> getCommands() {
        return commands;
    }

    public List<AgentSpec> getAgents() {
        return agents;
    }

    public List<TeamSpec> getTeams() {
        return teams;
    }

    public String getBasePath() {
        return basePath;
    }

    public InstallLocation getLocation() {
        return location;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Epoch millis of the scan that produced this result. Cache hits keep the original value.
     */
    public long getDiscoveredAt() {
        return discoveredAt;
    }

    public CommandSpec findCommand(String name) {
        if (name == null) {
            return null;
        }
        return commands.stream()
            .filter(c -> name.equals(c.getName()))
            .findFirst()
            .orElse(null);
    }
}
