package com.gsdorchestrator.intent;

import com.gsdorchestrator.lifecycle.LifecycleStage;
import com.gsdorchestrator.models.CommandSpec;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Commands that make sense at each lifecycle stage. Universal commands are valid everywhere; a command
 * listed for no stage is never offered by the statistical layer.
 */
public final class LifecycleFilter {

    public static final Set<String> UNIVERSAL_COMMANDS = Set.of(
        "gsd:help", "gsd:progress", "gsd:quick", "gsd:debug", "gsd:settings",
        "gsd:add-todo", "gsd:pause-work", "gsd:resume-work"
    );

    private static final Set<String> PLANNING_COMMANDS = Set.of(
        "gsd:plan-phase", "gsd:discuss-phase", "gsd:research-phase", "gsd:list-phase-assumptions",
        "gsd:add-phase", "gsd:insert-phase", "gsd:remove-phase"
    );

    private static final Map<LifecycleStage, Set<String>> STAGE_COMMANDS = new EnumMap<>(LifecycleStage.class);

    static {
        STAGE_COMMANDS.put(LifecycleStage.UNINITIALIZED, Set.of("gsd:new-project"));
        STAGE_COMMANDS.put(LifecycleStage.INITIALIZED, Set.of("gsd:new-milestone"));
        STAGE_COMMANDS.put(LifecycleStage.ROADMAPPED, PLANNING_COMMANDS);
        STAGE_COMMANDS.put(LifecycleStage.PLANNING, PLANNING_COMMANDS);
        STAGE_COMMANDS.put(LifecycleStage.EXECUTING, Set.of("gsd:execute-phase", "gsd:plan-phase", "gsd:verify-work"));
        STAGE_COMMANDS.put(LifecycleStage.VERIFYING, Set.of("gsd:verify-work", "gsd:execute-phase"));
        STAGE_COMMANDS.put(LifecycleStage.MILESTONE_END, Set.of(
            "gsd:audit-milestone", "gsd:complete-milestone", "gsd:new-milestone", "gsd:plan-milestone-gaps"));
        STAGE_COMMANDS.put(LifecycleStage.BETWEEN_PHASES, Set.of(
            "gsd:plan-phase", "gsd:discuss-phase", "gsd:audit-milestone"));
    }

    private LifecycleFilter() {
    }

    public static Set<String> validCommandNames(LifecycleStage stage) {
        Set<String> names = new HashSet<>(UNIVERSAL_COMMANDS);
        names.addAll(STAGE_COMMANDS.getOrDefault(stage, Set.of()));
        return names;
    }

    public static List<CommandSpec> filterByLifecycle(List<CommandSpec> commands, LifecycleStage stage) {
        Set<String> valid = validCommandNames(stage);
        List<CommandSpec> result = new ArrayList<>();
        for (CommandSpec command : commands) {
            if (valid.contains(command.getName())) {
                result.add(command);
            }
        }
        return result;
    }
}
