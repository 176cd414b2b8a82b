package com.gsdorchestrator.models;

import java.util.ArrayList;
import java.util.List;

public class ParsedState {

    private CurrentPosition position = new CurrentPosition();
    private List<String> decisions = new ArrayList<>();
    private List<String> blockers = new ArrayList<>();
    private List<String> pendingTodos = new ArrayList<>();
    private SessionContinuity sessionContinuity = new SessionContinuity();

    public CurrentPosition getPosition() {
        return position;
    }

    public void setPosition(CurrentPosition position) {
        this.position = position;
    }

    public List<String> getDecisions() {
        return decisions;
    }

    public void setDecisions(List<String> decisions) {
        this.decisions = decisions != null ? new ArrayList<>(decisions) : new ArrayList<>();
    }

    public List<String> getBlockers() {
        return blockers;
    }

    public void setBlockers(List<String> blockers) {
        this.blockers = blockers != null ? new ArrayList<>(blockers) : new ArrayList<>();
    }

    public List<String> getPendingTodos() {
        return pendingTodos;
    }

    public void setPendingTodos(List<String> pendingTodos) {
        this.pendingTodos = pendingTodos != null ? new ArrayList<>(pendingTodos) : new ArrayList<>();
    }

    public SessionContinuity getSessionContinuity() {
        return sessionContinuity;
    }

    public void setSessionContinuity(SessionContinuity sessionContinuity) {
        this.sessionContinuity = sessionContinuity;
    }
}
