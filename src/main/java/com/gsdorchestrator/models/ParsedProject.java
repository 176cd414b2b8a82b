package com.gsdorchestrator.models;

public class ParsedProject {

    private String name;
    private String coreValue;
    private String currentMilestone;
    private String description;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCoreValue() {
        return coreValue;
    }

    public void setCoreValue(String coreValue) {
        this.coreValue = coreValue;
    }

    public String getCurrentMilestone() {
        return currentMilestone;
    }

    public void setCurrentMilestone(String currentMilestone) {
        this.currentMilestone = currentMilestone;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
