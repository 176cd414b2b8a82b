package com.gsdorchestrator.lifecycle;

import com.gsdorchestrator.models.CurrentPosition;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.PlanInfo;
import com.gsdorchestrator.models.ProjectState;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the {@link LifecycleStage} of a project from its roadmap completion and the status text in
 * STATE.md.
 *
 * <ul>
 *   <li>no planning directory: {@code uninitialized}</li>
 *   <li>no roadmap: {@code initialized}</li>
 *   <li>roadmap without phases: {@code between-phases}</li>
 *   <li>every phase complete: {@code milestone-end}</li>
 *   <li>otherwise the first incomplete phase decides: no plans is {@code roadmapped} (or {@code planning}
 *       / {@code between-phases} when the status says so), open plans is {@code executing}, all plans done
 *       is {@code verifying}</li>
 * </ul>
 */
public final class StageResolver {

    private StageResolver() {
    }

    public static LifecycleStage deriveLifecycleStage(ProjectState state) {
        if (state == null || !state.isInitialized()) {
            return LifecycleStage.UNINITIALIZED;
        }
        if (!state.isHasRoadmap()) {
            return LifecycleStage.INITIALIZED;
        }
        List<PhaseInfo> phases = state.getPhases();
        if (phases == null || phases.isEmpty()) {
            return LifecycleStage.BETWEEN_PHASES;
        }

        PhaseInfo current = firstIncompletePhase(phases);
        if (current == null) {
            return LifecycleStage.MILESTONE_END;
        }

        List<PlanInfo> plans = plansFor(state.getPlansByPhase(), current.getNumber());
        if (plans == null || plans.isEmpty()) {
            String status = statusText(state.getPosition());
            if (status.contains("ready to plan") || status.contains("planning")) {
                return LifecycleStage.PLANNING;
            }
            if (status.contains("phase complete")) {
                return LifecycleStage.BETWEEN_PHASES;
            }
            return LifecycleStage.ROADMAPPED;
        }
        for (PlanInfo plan : plans) {
            if (!plan.isComplete()) {
                return LifecycleStage.EXECUTING;
            }
        }
        return LifecycleStage.VERIFYING;
    }

    public static PhaseInfo firstIncompletePhase(List<PhaseInfo> phases) {
        if (phases == null) {
            return null;
        }
        for (PhaseInfo phase : phases) {
            if (!phase.isComplete()) {
                return phase;
            }
        }
        return null;
    }

    /**
     * Next incomplete phase after {@code current} in roadmap order. Phase numbers are not assumed to be
     * consecutive.
     */
    public static PhaseInfo nextIncompletePhase(List<PhaseInfo> phases, PhaseInfo current) {
        if (phases == null || current == null) {
            return null;
        }
        int index = phases.indexOf(current);
        if (index < 0) {
            return null;
        }
        for (int i = index + 1; i < phases.size(); i++) {
            if (!phases.get(i).isComplete()) {
                return phases.get(i);
            }
        }
        return null;
    }

    /**
     * Plans for a phase, matching the key exactly first and then numerically so that {@code "3"} finds
     * plans recorded under {@code "03"}.
     */
    public static List<PlanInfo> plansFor(Map<String, List<PlanInfo>> plansByPhase, String phaseNumber) {
        if (plansByPhase == null || phaseNumber == null) {
            return null;
        }
        List<PlanInfo> direct = plansByPhase.get(phaseNumber);
        if (direct != null) {
            return direct;
        }
        BigDecimal wanted = toNumber(phaseNumber);
        if (wanted == null) {
            return null;
        }
        for (Map.Entry<String, List<PlanInfo>> entry : plansByPhase.entrySet()) {
            BigDecimal key = toNumber(entry.getKey());
            if (key != null && key.compareTo(wanted) == 0) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static BigDecimal toNumber(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String statusText(CurrentPosition position) {
        if (position == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (position.getStatus() != null) {
            sb.append(position.getStatus()).append(' ');
        }
        if (position.getPhaseStatus() != null) {
            sb.append(position.getPhaseStatus());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
