package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;

public class SemanticMatch {

    private final CommandSpec command;
    private final double similarity;

    public SemanticMatch(CommandSpec command, double similarity) {
        this.command = command;
        this.similarity = similarity;
    }

    public CommandSpec getCommand() {
        return command;
    }

    public double getSimilarity() {
        return similarity;
    }
}
