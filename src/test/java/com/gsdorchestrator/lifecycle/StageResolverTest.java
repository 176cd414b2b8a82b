package com.gsdorchestrator.lifecycle;

import com.gsdorchestrator.models.CurrentPosition;
import com.gsdorchestrator.models.PhaseInfo;
import com.gsdorchestrator.models.PlanInfo;
import com.gsdorchestrator.models.ProjectState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageResolverTest {

    private static ProjectState roadmapped(PhaseInfo... phases) {
        ProjectState state = new ProjectState();
        state.setInitialized(true);
        state.setHasRoadmap(true);
        state.setPhases(new ArrayList<>(List.of(phases)));
        return state;
    }

    private static void plans(ProjectState state, String phase, PlanInfo... plans) {
        Map<String, List<PlanInfo>> byPhase = new LinkedHashMap<>(state.getPlansByPhase());
        byPhase.put(phase, List.of(plans));
        state.setPlansByPhase(byPhase);
    }

    private static void status(ProjectState state, String status, String phaseStatus) {
        CurrentPosition position = new CurrentPosition();
        position.setStatus(status);
        position.setPhaseStatus(phaseStatus);
        state.setPosition(position);
    }

    @Test
    void noPlanningDirectoryIsUninitialized() {
        assertEquals(LifecycleStage.UNINITIALIZED, StageResolver.deriveLifecycleStage(null));
        assertEquals(LifecycleStage.UNINITIALIZED, StageResolver.deriveLifecycleStage(ProjectState.uninitialized()));
    }

    @Test
    void noRoadmapIsInitialized() {
        ProjectState state = new ProjectState();
        state.setInitialized(true);
        assertEquals(LifecycleStage.INITIALIZED, StageResolver.deriveLifecycleStage(state));
    }

    @Test
    void roadmapWithoutPhasesIsBetweenPhases() {
        assertEquals(LifecycleStage.BETWEEN_PHASES, StageResolver.deriveLifecycleStage(roadmapped()));
    }

    @Test
    void allPhasesCompleteIsMilestoneEnd() {
        ProjectState state = roadmapped(new PhaseInfo("1", "A", true), new PhaseInfo("2", "B", true));
        assertEquals(LifecycleStage.MILESTONE_END, StageResolver.deriveLifecycleStage(state));
    }

    @Test
    void phaseWithoutPlansIsRoadmapped() {
        ProjectState state = roadmapped(new PhaseInfo("1", "A", true), new PhaseInfo("2", "B", false));
        assertEquals(LifecycleStage.ROADMAPPED, StageResolver.deriveLifecycleStage(state));
    }

    @Test
    void statusTextRefinesAPhaseWithoutPlans() {
        ProjectState planning = roadmapped(new PhaseInfo("2", "B", false));
        status(planning, "Ready to plan", null);
        assertEquals(LifecycleStage.PLANNING, StageResolver.deriveLifecycleStage(planning));

        ProjectState between = roadmapped(new PhaseInfo("2", "B", false));
        status(between, null, "Phase complete");
        assertEquals(LifecycleStage.BETWEEN_PHASES, StageResolver.deriveLifecycleStage(between));
    }

    @Test
    void openPlanIsExecuting() {
        ProjectState state = roadmapped(new PhaseInfo("3", "C", false));
        plans(state, "3", new PlanInfo("03-01", true, null), new PlanInfo("03-02", false, null));
        assertEquals(LifecycleStage.EXECUTING, StageResolver.deriveLifecycleStage(state));
    }

    @Test
    void allPlansDoneIsVerifying() {
        ProjectState state = roadmapped(new PhaseInfo("3", "C", false));
        plans(state, "03", new PlanInfo("03-01", true, null));
        assertEquals(LifecycleStage.VERIFYING, StageResolver.deriveLifecycleStage(state));
    }

    @Test
    void nextIncompletePhaseFollowsRoadmapOrder() {
        List<PhaseInfo> phases = List.of(
            new PhaseInfo("3", "C", false), new PhaseInfo("3.1", "Hotfix", true), new PhaseInfo("5", "E", false));
        assertEquals("5", StageResolver.nextIncompletePhase(phases, phases.get(0)).getNumber());
        assertNull(StageResolver.nextIncompletePhase(phases, phases.get(2)));
        assertEquals("3", StageResolver.firstIncompletePhase(phases).getNumber());
    }

    @Test
    void plansForMatchesNumerically() {
        Map<String, List<PlanInfo>> byPhase = Map.of("02.1", List.of(new PlanInfo("02.1-01", false, null)));
        assertEquals(1, StageResolver.plansFor(byPhase, "2.1").size());
        assertNull(StageResolver.plansFor(byPhase, "2"));
        assertNull(StageResolver.plansFor(byPhase, "abc"));
    }
}
