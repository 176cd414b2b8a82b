package com.gsdorchestrator.gates;

import java.util.Locale;

/**
 * Pure policy: decides whether a routed command may run.
 *
 * <table>
 *   <tr><th>gate</th><th>interactive</th><th>yolo</th></tr>
 *   <tr><td>low-confidence</td><td>confirm</td><td>confirm</td></tr>
 *   <tr><td>destructive</td><td>confirm</td><td>proceed</td></tr>
 *   <tr><td>routing</td><td>proceed</td><td>proceed</td></tr>
 * </table>
 *
 * Low confidence outranks the command's own type. A missing command name is blocked.
 */
public final class GateEvaluator {

    private GateEvaluator() {
    }

    public static GateDecision evaluateGate(String commandName, OperatingMode mode, double confidence) {
        return evaluateGate(commandName, mode, confidence, GateOptions.defaults());
    }

    public static GateDecision evaluateGate(String commandName, OperatingMode mode, double confidence,
                                            GateOptions options) {
        GateOptions opts = options != null ? options : GateOptions.defaults();
        OperatingMode effectiveMode = mode != null ? mode : OperatingMode.INTERACTIVE;

        if (commandName == null || commandName.isBlank()) {
            return new GateDecision(GateAction.BLOCK, GateType.ROUTING, commandName,
                "No command was resolved, nothing to run.", false);
        }

        // NaN fails every comparison, so test for "not at least the threshold".
        if (!(confidence >= opts.getLowConfidenceThreshold())) {
            return new GateDecision(GateAction.CONFIRM, GateType.LOW_CONFIDENCE, commandName,
                String.format(Locale.ROOT, "Matched %s with confidence %.2f, below %.2f. Confirm this is the intended command.",
                    commandName, confidence, opts.getLowConfidenceThreshold()),
                false);
        }

        if (opts.getDestructiveCommands().contains(commandName)) {
            if (effectiveMode == OperatingMode.YOLO) {
                return new GateDecision(GateAction.PROCEED, GateType.DESTRUCTIVE, commandName,
                    commandName + " modifies project files; proceeding without confirmation in yolo mode.", true);
            }
            return new GateDecision(GateAction.CONFIRM, GateType.DESTRUCTIVE, commandName,
                commandName + " modifies project files and needs confirmation.", false);
        }

        return new GateDecision(GateAction.PROCEED, GateType.ROUTING, commandName,
            "Routing to " + commandName + ".", false);
    }
}
