package com.gsdorchestrator.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gsdorchestrator.models.ProjectConfig;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads config.json in either the flat or the nested template shape and fills every absent field with its
 * default. Values of the wrong JSON type are replaced by the default as well; {@link ConfigValidator}
 * is what reports them.
 */
public class ConfigParser {

    private static final Set<String> MODELED = Set.of(
        "mode", "verbosity", "depth", "model_profile", "parallelization", "commit_docs",
        "workflow", "gates", "safety", "git"
    );
    private static final String[] HOISTED_FROM_PLANNING = {"commit_docs", "search_gitignored"};

    private final ObjectMapper objectMapper;

    public ConfigParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectConfig parse(String content) {
        if (MarkdownSections.isBlank(content)) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }
        return fromNode(hoistPlanning((ObjectNode) root.deepCopy()));
    }

    public ProjectConfig defaults() {
        return new ProjectConfig();
    }

    private ObjectNode hoistPlanning(ObjectNode root) {
        JsonNode planning = root.get("planning");
        if (planning == null || !planning.isObject()) {
            return root;
        }
        for (String key : HOISTED_FROM_PLANNING) {
            if (!root.has(key) && planning.has(key)) {
                root.set(key, planning.get(key));
            }
        }
        return root;
    }

    private ProjectConfig fromNode(ObjectNode root) {
        ProjectConfig config = new ProjectConfig();
        config.setMode(text(root, "mode", config.getMode()));
        config.setVerbosity(integer(root, "verbosity", config.getVerbosity()));
        config.setDepth(text(root, "depth", config.getDepth()));
        config.setModelProfile(text(root, "model_profile", config.getModelProfile()));
        config.setCommitDocs(bool(root, "commit_docs", config.isCommitDocs()));

        JsonNode parallelization = root.get("parallelization");
        if (parallelization != null && parallelization.isBoolean()) {
            config.setParallelization(parallelization.booleanValue());
        } else if (parallelization != null && parallelization.isObject()) {
            config.setParallelization(toMap(parallelization));
        }

        JsonNode workflow = object(root, "workflow");
        ProjectConfig.Workflow wf = config.getWorkflow();
        wf.setResearch(bool(workflow, "research", wf.isResearch()));
        wf.setPlanCheck(bool(workflow, "plan_check", wf.isPlanCheck()));
        wf.setVerifier(bool(workflow, "verifier", wf.isVerifier()));
        passThrough(workflow, Set.of("research", "plan_check", "verifier"), wf.getExtra());

        JsonNode gates = object(root, "gates");
        ProjectConfig.Gates g = config.getGates();
        g.setRequirePlanApproval(bool(gates, "require_plan_approval", g.isRequirePlanApproval()));
        g.setRequireCheckpointApproval(bool(gates, "require_checkpoint_approval", g.isRequireCheckpointApproval()));
        passThrough(gates, Set.of("require_plan_approval", "require_checkpoint_approval"), g.getExtra());

        JsonNode safety = object(root, "safety");
        ProjectConfig.Safety s = config.getSafety();
        s.setMaxFilesPerCommit(integer(safety, "max_files_per_commit", s.getMaxFilesPerCommit()));
        s.setRequireTests(bool(safety, "require_tests", s.isRequireTests()));
        passThrough(safety, Set.of("max_files_per_commit", "require_tests"), s.getExtra());

        JsonNode git = object(root, "git");
        ProjectConfig.Git gi = config.getGit();
        gi.setAutoCommit(bool(git, "auto_commit", gi.isAutoCommit()));
        gi.setCommitStyle(text(git, "commit_style", gi.getCommitStyle()));
        passThrough(git, Set.of("auto_commit", "commit_style"), gi.getExtra());

        passThrough(root, MODELED, config.getExtra());
        return config;
    }

    private void passThrough(JsonNode node, Set<String> modeled, Map<String, Object> target) {
        if (node == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!modeled.contains(field.getKey())) {
                target.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static JsonNode object(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isObject() ? node : null;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? value.textValue() : fallback;
    }

    private static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isIntegralNumber() && value.canConvertToInt() ? value.intValue() : fallback;
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isBoolean() ? value.booleanValue() : fallback;
    }
}
