package com.gsdorchestrator.gates;

import java.util.Set;

public class GateOptions {

    public static final Set<String> DEFAULT_DESTRUCTIVE_COMMANDS = Set.of(
        "gsd:remove-phase",
        "gsd:complete-milestone"
    );
    public static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.5;

    private Set<String> destructiveCommands = DEFAULT_DESTRUCTIVE_COMMANDS;
    private double lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;

    public static GateOptions defaults() {
        return new GateOptions();
    }

    /**
     * Replaces the destructive set entirely; commands left out are treated as routing.
     */
    public GateOptions destructiveCommands(Set<String> commands) {
        this.destructiveCommands = commands != null ? Set.copyOf(commands) : DEFAULT_DESTRUCTIVE_COMMANDS;
        return this;
    }

    public GateOptions lowConfidenceThreshold(double threshold) {
        this.lowConfidenceThreshold = threshold;
        return this;
    }

    public Set<String> getDestructiveCommands() {
        return destructiveCommands;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }
}
