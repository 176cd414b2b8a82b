package com.gsdorchestrator.lifecycle;

import java.util.List;

public class LifecycleSuggestion {

    private final SuggestedCommand primary;
    private final List<SuggestedCommand> alternatives;
    private final LifecycleStage stage;
    private final String context;

    public LifecycleSuggestion(SuggestedCommand primary, List<SuggestedCommand> alternatives,
                               LifecycleStage stage, String context) {
        this.primary = primary;
        this.alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        this.stage = stage;
        this.context = context;
    }

    public SuggestedCommand getPrimary() {
        return primary;
    }

    public List<SuggestedCommand> getAlternatives() {
        return alternatives;
    }

    public LifecycleStage getStage() {
        return stage;
    }

    public String getContext() {
        return context;
    }
}
