package com.gsdorchestrator.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a lifecycle stage and the artifacts of the current phase to a next-step suggestion.
 * Stage-level stages answer from a fixed table; phase-level stages read the artifacts.
 */
public final class TransitionRules {

    /** Commands that interrupt phase work without changing what comes next. */
    public static final Set<String> SIDE_QUEST_COMMANDS = Set.of("gsd:quick", "gsd:debug");

    /** Commands that change the roadmap and therefore always lead to planning. */
    public static final Map<String, String> PHASE_MUTATION_COMMANDS = Map.of(
        "gsd:insert-phase", "Newly inserted phase needs planning.",
        "gsd:add-phase", "Newly added phase needs planning."
    );

    /** Documented successor of a command, used when the phase artifacts do not settle the next step. */
    public static final Map<String, String> SUCCESSORS = Map.of(
        "gsd:discuss-phase", "gsd:plan-phase",
        "gsd:research-phase", "gsd:plan-phase",
        "gsd:plan-phase", "gsd:execute-phase",
        "gsd:execute-phase", "gsd:verify-work",
        "gsd:new-project", "gsd:new-milestone",
        "gsd:audit-milestone", "gsd:complete-milestone",
        "gsd:complete-milestone", "gsd:new-milestone"
    );

    private TransitionRules() {
    }

    public static LifecycleSuggestion deriveNextActions(PhaseArtifacts artifacts, LifecycleStage stage,
                                                        String afterCommand, String nextPhaseNumber) {
        if (stage.isStageLevel()) {
            return stageLevel(stage, afterCommand);
        }

        String phase = artifacts.getPhaseNumber();
        if (afterCommand != null && PHASE_MUTATION_COMMANDS.containsKey(afterCommand)) {
            String reason = PHASE_MUTATION_COMMANDS.get(afterCommand);
            return new LifecycleSuggestion(
                new SuggestedCommand("gsd:plan-phase", reason, phase, true),
                List.of(new SuggestedCommand("gsd:discuss-phase", "Discuss approach before planning.", phase)),
                stage, reason);
        }

        LifecycleSuggestion derived = phaseLevel(artifacts, stage, afterCommand, nextPhaseNumber);
        if (isInconclusive(artifacts) && afterCommand != null) {
            return preferSuccessor(derived, afterCommand, phase);
        }
        return derived;
    }

    static String enrichContext(String context, String afterCommand) {
        if (afterCommand == null || afterCommand.isBlank()) {
            return context;
        }
        if (SIDE_QUEST_COMMANDS.contains(afterCommand)) {
            return "Returning to phase work after " + afterCommand + ". " + context;
        }
        return "After " + afterCommand + ": " + context;
    }

    private static LifecycleSuggestion stageLevel(LifecycleStage stage, String afterCommand) {
        switch (stage) {
            case UNINITIALIZED:
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:new-project",
                        "Project not initialized. Run new-project to set up the .planning/ structure."),
                    List.of(), stage,
                    enrichContext("No .planning/ directory found. Initialize the project to begin.", afterCommand));
            case INITIALIZED:
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:new-milestone",
                        "Project initialized but no roadmap. Create a milestone to define phases."),
                    List.of(), stage,
                    enrichContext("Project structure exists but no roadmap. Create a milestone to plan work.",
                        afterCommand));
            case MILESTONE_END:
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:audit-milestone",
                        "All phases complete. Audit the milestone for quality and completeness."),
                    List.of(
                        new SuggestedCommand("gsd:complete-milestone", "Archive the milestone and prepare for the next one."),
                        new SuggestedCommand("gsd:new-milestone", "Start a new milestone immediately.")),
                    stage, enrichContext("All phases complete. Audit or close the milestone.", afterCommand));
            case BETWEEN_PHASES:
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:plan-phase", "Between phases. Plan the next phase to continue."),
                    List.of(
                        new SuggestedCommand("gsd:discuss-phase", "Discuss approach before planning."),
                        new SuggestedCommand("gsd:audit-milestone", "Check milestone-level progress.")),
                    stage, enrichContext("Between phases. Ready to plan the next one.", afterCommand));
            default:
                throw new IllegalArgumentException("Not a stage-level stage: " + stage);
        }
    }

    private static LifecycleSuggestion phaseLevel(PhaseArtifacts artifacts, LifecycleStage stage,
                                                  String afterCommand, String nextPhase) {
        String phase = artifacts.getPhaseNumber();

        if (artifacts.getPlanCount() == 0) {
            if (artifacts.isHasResearch()) {
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:plan-phase",
                        "Research complete. Create execution plans from research findings.", phase, true),
                    List.of(new SuggestedCommand("gsd:discuss-phase", "Discuss approach before committing to plans.", phase)),
                    stage, enrichContext("Phase " + phase + " has research but no plans. Ready to plan.", afterCommand));
            }
            if (artifacts.isHasContext()) {
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:plan-phase", "Context captured. Create detailed execution plans.", phase, true),
                    List.of(
                        new SuggestedCommand("gsd:research-phase", "Research the domain before planning.", phase),
                        new SuggestedCommand("gsd:discuss-phase", "Continue discussing approach.", phase)),
                    stage, enrichContext("Phase " + phase + " has context discussion but no plans. Ready to plan.",
                        afterCommand));
            }
            return new LifecycleSuggestion(
                new SuggestedCommand("gsd:discuss-phase", "No context or plans yet. Discuss the phase approach first.", phase),
                List.of(
                    new SuggestedCommand("gsd:plan-phase", "Skip discussion and create plans directly.", phase, true),
                    new SuggestedCommand("gsd:research-phase", "Research the domain before planning.", phase)),
                stage, enrichContext("Phase " + phase + " has no artifacts. Discuss or plan to begin.", afterCommand));
        }

        List<String> unexecuted = artifacts.getUnexecutedPlans();
        if (!unexecuted.isEmpty()) {
            int remaining = unexecuted.size();
            int total = artifacts.getPlanCount();
            String context = artifacts.isHasUat()
                ? "Phase " + phase + ": " + remaining + " gap closure plan(s) need execution before phase is complete."
                : "Phase " + phase + ": " + artifacts.getSummaryCount() + "/" + total + " plans executed, "
                    + remaining + " remaining.";
            return new LifecycleSuggestion(
                new SuggestedCommand("gsd:execute-phase",
                    remaining + " of " + total + " plans remaining. Continue execution.", phase, true),
                List.of(
                    new SuggestedCommand("gsd:verify-work", "Verify completed work before continuing.", phase),
                    new SuggestedCommand("gsd:plan-phase", "Review or update plans.", phase)),
                stage, enrichContext(context, afterCommand));
        }

        if (artifacts.getSummaryCount() != artifacts.getPlanCount()) {
            return new LifecycleSuggestion(
                new SuggestedCommand("gsd:progress", "Check project progress to determine next step."),
                List.of(), stage,
                enrichContext("Phase " + phase + " in ambiguous state. Check progress.", afterCommand));
        }

        if (artifacts.isHasUat()) {
            if (nextPhase != null) {
                return new LifecycleSuggestion(
                    new SuggestedCommand("gsd:discuss-phase",
                        "Phase " + phase + " complete. Discuss phase " + nextPhase + " approach.", nextPhase),
                    List.of(
                        new SuggestedCommand("gsd:plan-phase",
                            "Skip discussion and plan phase " + nextPhase + " directly.", nextPhase, true),
                        new SuggestedCommand("gsd:audit-milestone", "Check milestone-level progress.")),
                    stage, enrichContext("Phase " + phase + " complete and verified. Ready for next phase "
                        + nextPhase + ".", afterCommand));
            }
            return new LifecycleSuggestion(
                new SuggestedCommand("gsd:audit-milestone",
                    "All phases complete. Audit the milestone for quality and completeness."),
                List.of(new SuggestedCommand("gsd:complete-milestone", "Archive the milestone and prepare for the next one.")),
                stage, enrichContext("Phase " + phase + " complete and verified. No more phases to execute.",
                    afterCommand));
        }

        List<SuggestedCommand> alternatives = new ArrayList<>();
        if (nextPhase != null) {
            alternatives.add(new SuggestedCommand("gsd:plan-phase",
                "Plan the next phase (skip verification).", nextPhase));
        }
        alternatives.add(new SuggestedCommand("gsd:execute-phase", "Re-execute plans if needed.", phase, true));
        return new LifecycleSuggestion(
            new SuggestedCommand("gsd:verify-work", "All plans executed. Verify the work before moving on.", phase),
            alternatives, stage,
            enrichContext("Phase " + phase + ": all " + artifacts.getPlanCount()
                + " plans executed. Ready for verification.", afterCommand));
    }

    private static boolean isInconclusive(PhaseArtifacts artifacts) {
        return artifacts.getPlanCount() == 0 && !artifacts.isHasContext() && !artifacts.isHasResearch();
    }

    /**
     * Moves the successor of {@code afterCommand} to the front; the artifact-derived primary becomes the
     * first alternative.
     */
    private static LifecycleSuggestion preferSuccessor(LifecycleSuggestion derived, String afterCommand, String phase) {
        String successor = SUCCESSORS.get(afterCommand);
        if (successor == null || successor.equals(derived.getPrimary().getCommand())) {
            return derived;
        }
        List<SuggestedCommand> alternatives = new ArrayList<>();
        alternatives.add(derived.getPrimary());
        for (SuggestedCommand alternative : derived.getAlternatives()) {
            if (!alternative.getCommand().equals(successor)) {
                alternatives.add(alternative);
            }
        }
        boolean clear = "gsd:execute-phase".equals(successor) || "gsd:plan-phase".equals(successor);
        SuggestedCommand primary = new SuggestedCommand(successor,
            successor + " follows " + afterCommand + ".", phase, clear ? Boolean.TRUE : null);
        return new LifecycleSuggestion(primary, alternatives, derived.getStage(), derived.getContext());
    }
}
