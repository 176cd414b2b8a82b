package com.gsdorchestrator.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsdorchestrator.models.TeamMember;
import com.gsdorchestrator.models.TeamSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code teams/<name>/config.json}. Members come either as {@code {agentId, role}} entries next to
 * a {@code leadAgentId}, or as inline {@code {name, role, description, tools, model}} definitions.
 */
public class TeamConfigParser {

    private final ObjectMapper objectMapper;

    public TeamConfigParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TeamSpec parse(String content, String path) {
        if (content == null || content.isBlank()) {
            throw new ArtifactParseException(path, "Team config is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ArtifactParseException(path, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ArtifactParseException(path, "Team config must be a JSON object");
        }
        String name = text(root, "name");
        if (name == null) {
            throw new ArtifactParseException(path, "Team is missing required field 'name'");
        }
        JsonNode membersNode = root.get("members");
        if (membersNode == null || !membersNode.isArray()) {
            throw new ArtifactParseException(path, "Team is missing a 'members' array");
        }

        List<TeamMember> members = new ArrayList<>();
        for (JsonNode node : membersNode) {
            if (!node.isObject()) {
                continue;
            }
            String id = text(node, "agentId");
            if (id == null) {
                id = text(node, "name");
            }
            if (id == null) {
                continue;
            }
            members.add(new TeamMember(id, text(node, "role"), text(node, "description"), text(node, "model")));
        }

        String leadAgentId = text(root, "leadAgentId");
        if (leadAgentId == null) {
            leadAgentId = members.stream()
                .filter(m -> "leader".equalsIgnoreCase(m.getRole()) || "lead".equalsIgnoreCase(m.getRole()))
                .map(TeamMember::getAgentId)
                .findFirst()
                .orElse(null);
        }

        return new TeamSpec(name, text(root, "description"), text(root, "topology"), leadAgentId, members, path);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
