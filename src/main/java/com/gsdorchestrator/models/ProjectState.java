package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a project's planning directory, assembled from ROADMAP.md, STATE.md, PROJECT.md and
 * config.json. Missing documents leave their parts null and the matching {@code has*} flag false.
 */
public class ProjectState {

    private boolean initialized;
    private ProjectConfig config = new ProjectConfig();
    private CurrentPosition position;
    private List<PhaseInfo> phases = new ArrayList<>();
    private Map<String, List<PlanInfo>> plansByPhase = new LinkedHashMap<>();
    private ParsedRoadmap roadmap;
    private ParsedProject project;
    private ParsedState state;
    private boolean hasRoadmap;
    private boolean hasState;
    private boolean hasProject;
    private boolean hasConfig;
    private String planningDir;

    public static ProjectState uninitialized() {
        return new ProjectState();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public ProjectConfig getConfig() {
        return config;
    }

    public void setConfig(ProjectConfig config) {
        this.config = config != null ? config : new ProjectConfig();
    }

    public CurrentPosition getPosition() {
        return position;
    }

    public void setPosition(CurrentPosition position) {
        this.position = position;
    }

    public List<PhaseInfo> getPhases() {
        return phases;
    }

    public void setPhases(List<PhaseInfo> phases) {
        this.phases = phases != null ? phases : new ArrayList<>();
    }

    public Map<String, List<PlanInfo>> getPlansByPhase() {
        return plansByPhase;
    }

    public void setPlansByPhase(Map<String, List<PlanInfo>> plansByPhase) {
        this.plansByPhase = plansByPhase != null ? plansByPhase : new LinkedHashMap<>();
    }

    public ParsedRoadmap getRoadmap() {
        return roadmap;
    }

    public void setRoadmap(ParsedRoadmap roadmap) {
        this.roadmap = roadmap;
    }

    public ParsedProject getProject() {
        return project;
    }

    public void setProject(ParsedProject project) {
        this.project = project;
    }

    public ParsedState getState() {
        return state;
    }

    public void setState(ParsedState state) {
        this.state = state;
    }

    public boolean isHasRoadmap() {
        return hasRoadmap;
    }

    public void setHasRoadmap(boolean hasRoadmap) {
        this.hasRoadmap = hasRoadmap;
    }

    public boolean isHasState() {
        return hasState;
    }

    public void setHasState(boolean hasState) {
        this.hasState = hasState;
    }

    public boolean isHasProject() {
        return hasProject;
    }

    public void setHasProject(boolean hasProject) {
        this.hasProject = hasProject;
    }

    public boolean isHasConfig() {
        return hasConfig;
    }

    public void setHasConfig(boolean hasConfig) {
        this.hasConfig = hasConfig;
    }

    /**
     * Directory the snapshot was read from; used to scan phase artifacts.
     */
    @JsonIgnore
    public String getPlanningDir() {
        return planningDir;
    }

    public void setPlanningDir(String planningDir) {
        this.planningDir = planningDir;
    }
}
