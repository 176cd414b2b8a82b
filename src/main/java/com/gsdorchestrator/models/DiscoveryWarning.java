package com.gsdorchestrator.models;

/**
 * Record of an artifact that discovery skipped.
 */
public class DiscoveryWarning {

    public static final String PARSE_ERROR = "parse-error";

    private final String type;
    private final String path;
    private final String message;

    public DiscoveryWarning(String type, String path, String message) {
        this.type = type;
        this.path = path;
        this.message = message;
    }

    public static DiscoveryWarning parseError(String path, String message) {
        return new DiscoveryWarning(PARSE_ERROR, path, message);
    }

    public String getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return type + ": " + path + " (" + message + ")";
    }
}
