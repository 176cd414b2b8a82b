package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The {@code ## Current Position} block of STATE.md. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CurrentPosition {

    private Double phase;
    private Integer totalPhases;
    private String phaseName;
    private String phaseStatus;
    private Integer plan;
    private Integer totalPlans;
    private String status;
    private Integer progressPercent;
    private String lastActivity;

    public Double getPhase() {
        return phase;
    }

    public void setPhase(Double phase) {
        this.phase = phase;
    }

    public Integer getTotalPhases() {
        return totalPhases;
    }

    public void setTotalPhases(Integer totalPhases) {
        this.totalPhases = totalPhases;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public void setPhaseName(String phaseName) {
        this.phaseName = phaseName;
    }

    public String getPhaseStatus() {
        return phaseStatus;
    }

    public void setPhaseStatus(String phaseStatus) {
        this.phaseStatus = phaseStatus;
    }

    public Integer getPlan() {
        return plan;
    }

    public void setPlan(Integer plan) {
        this.plan = plan;
    }

    public Integer getTotalPlans() {
        return totalPlans;
    }

    public void setTotalPlans(Integer totalPlans) {
        this.totalPlans = totalPlans;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getProgressPercent() {
        return progressPercent;
    }

    public void setProgressPercent(Integer progressPercent) {
        this.progressPercent = progressPercent;
    }

    public String getLastActivity() {
        return lastActivity;
    }

    public void setLastActivity(String lastActivity) {
        this.lastActivity = lastActivity;
    }
}
