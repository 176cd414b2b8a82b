package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Planning configuration ({@code .planning/config.json}) with every field defaulted.
 * Keys this class does not model are kept in {@link #getExtra()} and written back out unchanged.
 */
public class ProjectConfig {

    public static final String DEFAULT_MODE = "interactive";
    public static final int DEFAULT_VERBOSITY = 3;
    public static final String DEFAULT_DEPTH = "standard";
    public static final String DEFAULT_MODEL_PROFILE = "balanced";

    private String mode = DEFAULT_MODE;
    private int verbosity = DEFAULT_VERBOSITY;
    private String depth = DEFAULT_DEPTH;
    private String modelProfile = DEFAULT_MODEL_PROFILE;
    // Boolean, or a Map such as {max_parallel: 4, ...}
    private Object parallelization = Boolean.FALSE;
    private boolean commitDocs = true;
    private Workflow workflow = new Workflow();
    private Gates gates = new Gates();
    private Safety safety = new Safety();
    private Git git = new Git();
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public void setVerbosity(int verbosity) {
        this.verbosity = verbosity;
    }

    public String getDepth() {
        return depth;
    }

    public void setDepth(String depth) {
        this.depth = depth;
    }

    @JsonProperty("model_profile")
    public String getModelProfile() {
        return modelProfile;
    }

    public void setModelProfile(String modelProfile) {
        this.modelProfile = modelProfile;
    }

    public Object getParallelization() {
        return parallelization;
    }

    public void setParallelization(Object parallelization) {
        this.parallelization = parallelization;
    }

    @JsonProperty("commit_docs")
    public boolean isCommitDocs() {
        return commitDocs;
    }

    public void setCommitDocs(boolean commitDocs) {
        this.commitDocs = commitDocs;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public void setWorkflow(Workflow workflow) {
        this.workflow = workflow;
    }

    public Gates getGates() {
        return gates;
    }

    public void setGates(Gates gates) {
        this.gates = gates;
    }

    public Safety getSafety() {
        return safety;
    }

    public void setSafety(Safety safety) {
        this.safety = safety;
    }

    public Git getGit() {
        return git;
    }

    public void setGit(Git git) {
        this.git = git;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonIgnore
    public boolean isYolo() {
        return "yolo".equals(mode);
    }

    public static class Workflow {
        private boolean research = true;
        private boolean planCheck = true;
        private boolean verifier = true;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public boolean isResearch() {
            return research;
        }

        public void setResearch(boolean research) {
            this.research = research;
        }

        @JsonProperty("plan_check")
        public boolean isPlanCheck() {
            return planCheck;
        }

        public void setPlanCheck(boolean planCheck) {
            this.planCheck = planCheck;
        }

        public boolean isVerifier() {
            return verifier;
        }

        public void setVerifier(boolean verifier) {
            this.verifier = verifier;
        }

        @JsonAnyGetter
        public Map<String, Object> getExtra() {
            return extra;
        }

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extra.put(key, value);
        }
    }

    public static class Gates {
        private boolean requirePlanApproval = false;
        private boolean requireCheckpointApproval = true;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        @JsonProperty("require_plan_approval")
        public boolean isRequirePlanApproval() {
            return requirePlanApproval;
        }

        public void setRequirePlanApproval(boolean requirePlanApproval) {
            this.requirePlanApproval = requirePlanApproval;
        }

        @JsonProperty("require_checkpoint_approval")
        public boolean isRequireCheckpointApproval() {
            return requireCheckpointApproval;
        }

        public void setRequireCheckpointApproval(boolean requireCheckpointApproval) {
            this.requireCheckpointApproval = requireCheckpointApproval;
        }

        @JsonAnyGetter
        public Map<String, Object> getExtra() {
            return extra;
        }

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extra.put(key, value);
        }
    }

    public static class Safety {
        private int maxFilesPerCommit = 20;
        private boolean requireTests = true;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        @JsonProperty("max_files_per_commit")
        public int getMaxFilesPerCommit() {
            return maxFilesPerCommit;
        }

        public void setMaxFilesPerCommit(int maxFilesPerCommit) {
            this.maxFilesPerCommit = maxFilesPerCommit;
        }

        @JsonProperty("require_tests")
        public boolean isRequireTests() {
            return requireTests;
        }

        public void setRequireTests(boolean requireTests) {
            this.requireTests = requireTests;
        }

        @JsonAnyGetter
        public Map<String, Object> getExtra() {
            return extra;
        }

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extra.put(key, value);
        }
    }

    public static class Git {
        private boolean autoCommit = true;
        private String commitStyle = "conventional";
        private final Map<String, Object> extra = new LinkedHashMap<>();

        @JsonProperty("auto_commit")
        public boolean isAutoCommit() {
            return autoCommit;
        }

        public void setAutoCommit(boolean autoCommit) {
            this.autoCommit = autoCommit;
        }

        @JsonProperty("commit_style")
        public String getCommitStyle() {
            return commitStyle;
        }

        public void setCommitStyle(String commitStyle) {
            this.commitStyle = commitStyle;
        }

        @JsonAnyGetter
        public Map<String, Object> getExtra() {
            return extra;
        }

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extra.put(key, value);
        }
    }
}
