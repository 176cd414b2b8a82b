package com.gsdorchestrator.lifecycle;

import com.gsdorchestrator.AppLogger;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.ProjectState;
import com.gsdorchestrator.state.ProjectStateReader;

import java.nio.file.Path;

/**
 * Recommends the next command for a project. The stage comes from {@link StageResolver}; for phase-level
 * stages the first incomplete phase's directory is scanned and {@link TransitionRules} picks the step.
 */
public class LifecycleCoordinator {

    private final ArtifactScanner scanner;
    private final AppLogger logger;

    public LifecycleCoordinator(Path planningDir) {
        this.scanner = new ArtifactScanner(planningDir.resolve(ProjectStateReader.PHASES_DIR));
        this.logger = AppLogger.get();
    }

    public LifecycleSuggestion suggestNextStep(ProjectState state) {
        return suggestNextStep(state, null);
    }

    public LifecycleSuggestion suggestNextStep(ProjectState state, String afterCommand) {
        String completed = afterCommand == null || afterCommand.isBlank() ? null : afterCommand.trim();
        LifecycleStage stage = StageResolver.deriveLifecycleStage(state);

        if (stage.isStageLevel()) {
            return TransitionRules.deriveNextActions(PhaseArtifacts.empty(null, null, null), stage, completed, null);
        }

        PhaseInfo current = StageResolver.firstIncompletePhase(state.getPhases());
        PhaseArtifacts artifacts = current.getDirectory() != null
            ? withRoadmapNumber(scanner.scan(current.getDirectory()), current)
            : PhaseArtifacts.empty(current.getNumber(), current.getName(), null);

        PhaseInfo next = StageResolver.nextIncompletePhase(state.getPhases(), current);
        LifecycleSuggestion suggestion = TransitionRules.deriveNextActions(
            artifacts, stage, completed, next != null ? next.getNumber() : null);
        logger.info("Lifecycle: stage " + stage + ", phase " + current.getNumber() + ", suggesting "
            + suggestion.getPrimary());
        return suggestion;
    }

    // The roadmap's spelling of the phase number wins over the directory prefix ("39" not "039").
    private static PhaseArtifacts withRoadmapNumber(PhaseArtifacts scanned, PhaseInfo phase) {
        if (phase.getNumber() == null || phase.getNumber().equals(scanned.getPhaseNumber())) {
            return scanned;
        }
        return new PhaseArtifacts(phase.getNumber(), scanned.getPhaseName(), scanned.getPhaseDirectory(),
            scanned.getPlanIds(), scanned.getSummaryIds(), scanned.isHasContext(), scanned.isHasResearch(),
            scanned.isHasUat(), scanned.isHasVerification());
    }
}
