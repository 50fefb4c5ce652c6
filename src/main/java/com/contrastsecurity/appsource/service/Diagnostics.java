package com.contrastsecurity.appsource.service;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects {@link Diagnostic} events for the caller and forwards each one to a logger.
 *
 * Messages use SLF4J {@code {}} placeholders.
 */
public class Diagnostics {
    private final Logger logger;
    private final List<Diagnostic> events = new ArrayList<>();

    public Diagnostics(Logger logger) {
        this.logger = logger;
    }

    public void debug(String format, Object... args) {
        logger.debug(format, args);
        events.add(new Diagnostic(Diagnostic.Level.DEBUG, render(format, args)));
    }

    public void info(String format, Object... args) {
        logger.info(format, args);
        events.add(new Diagnostic(Diagnostic.Level.INFO, render(format, args)));
    }

    public void warn(String format, Object... args) {
        logger.warn(format, args);
        events.add(new Diagnostic(Diagnostic.Level.WARN, render(format, args)));
    }

    public void error(String format, Object... args) {
        logger.error(format, args);
        events.add(new Diagnostic(Diagnostic.Level.ERROR, render(format, args)));
    }

    /**
     * Copy events recorded elsewhere without logging them a second time.
     */
    public void addAll(Diagnostics other) {
        events.addAll(other.events);
    }

    public List<Diagnostic> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<Diagnostic> atLevel(Diagnostic.Level level) {
        return events.stream().filter(e -> e.getLevel() == level).collect(Collectors.toList());
    }

    public boolean hasWarnings() {
        return events.stream().anyMatch(e -> e.getLevel() == Diagnostic.Level.WARN || e.getLevel() == Diagnostic.Level.ERROR);
    }

    /**
     * Substitute {@code {}} placeholders the way the logger does.
     */
    static String render(String format, Object... args) {
        return MessageFormatter.arrayFormat(format, args).getMessage();
    }
}
