package com.gsdorchestrator.intent;

import java.util.List;

/**
 * Structured values pulled out of a query. Absent values are null; {@code flags} is never null.
 */
public class ExtractedArguments {

    private final String phaseNumber;
    private final List<String> flags;
    private final String description;
    private final String version;
    private final String profile;
    private final String raw;

    public ExtractedArguments(String phaseNumber, List<String> flags, String description, String version,
                              String profile, String raw) {
        this.phaseNumber = phaseNumber;
        this.flags = flags != null ? List.copyOf(flags) : List.of();
        this.description = description;
        this.version = version;
        this.profile = profile;
        this.raw = raw;
    }

    public static ExtractedArguments empty(String raw) {
        return new ExtractedArguments(null, null, null, null, null, raw != null ? raw : "");
    }

    public String getPhaseNumber() {
        return phaseNumber;
    }

    public List<String> getFlags() {
        return flags;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public String getProfile() {
        return profile;
    }

    public String getRaw() {
        return raw;
    }
}
