package com.gsdorchestrator.gates;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GateEvaluatorTest {

    @Test
    void confidentRoutingProceeds() {
        GateDecision decision = GateEvaluator.evaluateGate("gsd:plan-phase", OperatingMode.INTERACTIVE, 0.9);
        assertEquals(GateAction.PROCEED, decision.getAction());
        assertEquals(GateType.ROUTING, decision.getGateType());
        assertEquals("gsd:plan-phase", decision.getCommand());
        assertFalse(decision.isSkippedByYolo());
    }

    @Test
    void lowConfidenceAlwaysConfirms() {
        for (OperatingMode mode : OperatingMode.values()) {
            GateDecision decision = GateEvaluator.evaluateGate("gsd:progress", mode, 0.3);
            assertEquals(GateAction.CONFIRM, decision.getAction(), "mode " + mode);
            assertEquals(GateType.LOW_CONFIDENCE, decision.getGateType());
            assertTrue(decision.getReason().contains("0.30"));
        }
    }

    @Test
    void thresholdItselfIsConfidentEnough() {
        assertEquals(GateType.ROUTING,
            GateEvaluator.evaluateGate("gsd:progress", OperatingMode.INTERACTIVE, 0.5).getGateType());
    }

    @Test
    void lowConfidenceOutranksDestructive() {
        GateDecision decision = GateEvaluator.evaluateGate("gsd:remove-phase", OperatingMode.YOLO, 0.2);
        assertEquals(GateType.LOW_CONFIDENCE, decision.getGateType());
        assertEquals(GateAction.CONFIRM, decision.getAction());
    }

    @Test
    void destructiveConfirmsInInteractiveMode() {
        GateDecision decision = GateEvaluator.evaluateGate("gsd:complete-milestone", OperatingMode.INTERACTIVE, 1.0);
        assertEquals(GateAction.CONFIRM, decision.getAction());
        assertEquals(GateType.DESTRUCTIVE, decision.getGateType());
        assertFalse(decision.isSkippedByYolo());
    }

    @Test
    void yoloSkipsDestructiveConfirmation() {
        GateDecision decision = GateEvaluator.evaluateGate("gsd:remove-phase", OperatingMode.YOLO, 1.0);
        assertEquals(GateAction.PROCEED, decision.getAction());
        assertEquals(GateType.DESTRUCTIVE, decision.getGateType());
        assertTrue(decision.isSkippedByYolo());
    }

    @Test
    void missingCommandIsBlocked() {
        assertEquals(GateAction.BLOCK, GateEvaluator.evaluateGate(null, OperatingMode.YOLO, 1.0).getAction());
        assertEquals(GateAction.BLOCK, GateEvaluator.evaluateGate(" ", OperatingMode.INTERACTIVE, 1.0).getAction());
    }

    @Test
    void nanConfidenceNeedsConfirmation() {
        assertEquals(GateType.LOW_CONFIDENCE,
            GateEvaluator.evaluateGate("gsd:progress", OperatingMode.YOLO, Double.NaN).getGateType());
    }

    @Test
    void nullModeIsInteractive() {
        assertEquals(GateAction.CONFIRM,
            GateEvaluator.evaluateGate("gsd:remove-phase", null, 1.0).getAction());
        assertEquals(OperatingMode.YOLO, OperatingMode.fromValue(" YOLO "));
        assertEquals(OperatingMode.INTERACTIVE, OperatingMode.fromValue("turbo"));
    }

    @Test
    void optionsOverrideDefaults() {
        GateOptions options = GateOptions.defaults()
            .destructiveCommands(Set.of("gsd:update"))
            .lowConfidenceThreshold(0.8);

        assertEquals(GateType.DESTRUCTIVE,
            GateEvaluator.evaluateGate("gsd:update", OperatingMode.INTERACTIVE, 0.9, options).getGateType());
        assertEquals(GateType.ROUTING,
            GateEvaluator.evaluateGate("gsd:remove-phase", OperatingMode.INTERACTIVE, 0.9, options).getGateType());
        assertEquals(GateType.LOW_CONFIDENCE,
            GateEvaluator.evaluateGate("gsd:progress", OperatingMode.INTERACTIVE, 0.7, options).getGateType());
    }

    @Test
    void decisionsAreValues() {
        assertEquals(GateEvaluator.evaluateGate("gsd:progress", OperatingMode.YOLO, 0.9),
            GateEvaluator.evaluateGate("gsd:progress", OperatingMode.YOLO, 0.9));
    }
}
