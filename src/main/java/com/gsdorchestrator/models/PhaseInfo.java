package com.gsdorchestrator.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One roadmap phase. {@code number} keeps its written form ("3", "37.1").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PhaseInfo {

    private String number;
    private String name;
    private boolean complete;
    private String completedInfo;
    private String description;
    private String directory;

    public PhaseInfo() {}

    public PhaseInfo(String number, String name, boolean complete) {
        this.number = number;
        this.name = name;
        this.complete = complete;
    }

    public String getNumber() {
        return number;
    }

    public void setNumber(String number) {
        this.number = number;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    public String getCompletedInfo() {
        return completedInfo;
    }

    public void setCompletedInfo(String completedInfo) {
        this.completedInfo = completedInfo;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Name of the matching directory under {@code phases/}, when one exists.
     */
    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
