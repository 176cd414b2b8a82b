package com.gsdorchestrator.gates;

import java.util.Objects;

public class GateDecision {

    private final GateAction action;
    private final GateType gateType;
    private final String command;
    private final String reason;
    private final boolean skippedByYolo;

    public GateDecision(GateAction action, GateType gateType, String command, String reason, boolean skippedByYolo) {
        this.action = action;
        this.gateType = gateType;
        this.command = command;
        this.reason = reason;
        this.skippedByYolo = skippedByYolo;
    }

    public GateAction getAction() {
        return action;
    }

    public GateType getGateType() {
        return gateType;
    }

    public String getCommand() {
        return command;
    }

    public String getReason() {
        return reason;
    }

    /**
     * True when fast mode let a destructive command through without confirmation.
     */
    public boolean isSkippedByYolo() {
        return skippedByYolo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GateDecision)) return false;
        GateDecision other = (GateDecision) o;
        return action == other.action
            && gateType == other.gateType
            && skippedByYolo == other.skippedByYolo
            && Objects.equals(command, other.command)
            && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, gateType, command, reason, skippedByYolo);
    }

    @Override
    public String toString() {
        return gateType.getValue() + " -> " + action.getValue() + " (" + reason + ")";
    }
}
