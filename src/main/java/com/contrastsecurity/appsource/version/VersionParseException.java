package com.contrastsecurity.appsource.version;

/**
 * Thrown when a version string cannot be parsed.
 *
 * Unchecked so it can escape {@link java.util.Comparator#compare}; the merge engine
 * catches it at the per-source boundary.
 */
public class VersionParseException extends RuntimeException {
    private final String input;

    public VersionParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    public VersionParseException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * The string that failed to parse, may be null.
     */
    public String getInput() {
        return input;
    }
}
