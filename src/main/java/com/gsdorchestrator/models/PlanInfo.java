package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanInfo {

    private String id;
    private boolean complete;
    private String description;

    public PlanInfo() {}

    public PlanInfo(String id, boolean complete, String description) {
        this.id = id;
        this.complete = complete;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
