package com.gsdorchestrator.discovery;

/**
 * Raised by the artifact parsers when a file fails structural parsing. Discovery turns it into a
 * {@code parse-error} warning and moves on.
 */
public class ArtifactParseException extends RuntimeException {
    private final String path;

    public ArtifactParseException(String path, String detail) {
        super(detail);
        this.path = path;
    }

    public ArtifactParseException(String path, String detail, Throwable cause) {
        super(detail, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
