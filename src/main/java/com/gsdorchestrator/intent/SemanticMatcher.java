package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;

import java.util.List;

/**
 * Embedding-based similarity supplied by the companion extension. This project only consumes it; the
 * embeddings themselves are computed by the provider.
 */
public interface SemanticMatcher {

    boolean isReady();

    /**
     * Similarity of the query to each candidate, highest first.
     */
    List<SemanticMatch> match(String query, List<CommandSpec> candidates);

    /**
     * Text a provider should embed for a command.
     */
    static String embeddingText(CommandSpec command) {
        String objective = command.getObjective();
        if (objective == null || objective.isBlank()) {
            return command.getDescription();
        }
        return command.getDescription() + ". " + objective;
    }
}
