package com.contrastsecurity.appsource.service;

/**
 * One event recorded while working on a catalog.
 */
public class Diagnostic {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private final Level level;
    private final String message;

    public Diagnostic(Level level, String message) {
        this.level = level;
        this.message = message;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return level + ": " + message;
    }
}
