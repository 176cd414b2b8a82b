package com.gsdorchestrator.intent;

import com.gsdorchestrator.models.CommandSpec;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes explicit invocations such as {@code /gsd:plan-phase 3 --research}. The leading slash is
 * optional. Syntax alone is not enough: the command must exist in the discovered set.
 */
final class ExactMatcher {

    private static final Pattern INVOCATION = Pattern.compile(
        "^/?([a-z0-9][a-z0-9-]*):([a-z0-9][a-z0-9-]*)(?:\\s+(.*))?$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private ExactMatcher() {
    }

    static Match match(String input, Map<String, CommandSpec> commandsByName) {
        Matcher m = INVOCATION.matcher(input.trim());
        if (!m.matches()) {
            return null;
        }
        String name = (m.group(1) + ":" + m.group(2)).toLowerCase(Locale.ROOT);
        CommandSpec command = commandsByName.get(name);
        if (command == null) {
            return null;
        }
        String rawArgs = m.group(3) != null ? m.group(3).trim() : "";
        return new Match(command, rawArgs);
    }

    static final class Match {
        private final CommandSpec command;
        private final String rawArgs;

        Match(CommandSpec command, String rawArgs) {
            this.command = command;
            this.rawArgs = rawArgs;
        }

        CommandSpec getCommand() {
            return command;
        }

        String getRawArgs() {
            return rawArgs;
        }
    }
}
