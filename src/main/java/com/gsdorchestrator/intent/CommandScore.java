package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;

/**
 * A candidate command with its normalized confidence.
 */
public class CommandScore {

    private final CommandSpec command;
    private final double confidence;

    public CommandScore(CommandSpec command, double confidence) {
        this.command = command;
        this.confidence = confidence;
    }

    public CommandSpec getCommand() {
        return command;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return command.getName() + "=" + confidence;
    }
}
