package com.gsdorchestrator.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One recommended command with the reason for it. {@code args} and {@code clearContext} are only set
 * when they apply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestedCommand {

    private final String command;
    private final String reason;
    private final String args;
    private final Boolean clearContext;

    public SuggestedCommand(String command, String reason) {
        this(command, reason, null, null);
    }

    public SuggestedCommand(String command, String reason, String args) {
        this(command, reason, args, null);
    }

    public SuggestedCommand(String command, String reason, String args, Boolean clearContext) {
        this.command = command;
        this.reason = reason;
        this.args = args;
        this.clearContext = clearContext;
    }

    public String getCommand() {
        return command;
    }

    public String getReason() {
        return reason;
    }

    public String getArgs() {
        return args;
    }

    public Boolean getClearContext() {
        return clearContext;
    }

    @Override
    public String toString() {
        return command + (args != null ? " " + args : "");
    }
}
