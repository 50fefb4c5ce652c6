package com.contrastsecurity.appsource.service;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one update run. The counters only include configuration entries that
 * completed successfully.
 */
public class UpdateSummary {
    private final int appsUpdated;
    private final int appsAdded;
    private final int newsAdded;
    private final List<String> failedSources;
    private final Diagnostics diagnostics;

    public UpdateSummary(int appsUpdated, int appsAdded, int newsAdded,
                         List<String> failedSources, Diagnostics diagnostics) {
        this.appsUpdated = appsUpdated;
        this.appsAdded = appsAdded;
        this.newsAdded = newsAdded;
        this.failedSources = Collections.unmodifiableList(failedSources);
        this.diagnostics = diagnostics;
    }

    public int getAppsUpdated() {
        return appsUpdated;
    }

    public int getAppsAdded() {
        return appsAdded;
    }

    public int getNewsAdded() {
        return newsAdded;
    }

    /**
     * Descriptions of the configuration entries that failed and were rolled back.
     */
    public List<String> getFailedSources() {
        return failedSources;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "Updated " + appsUpdated + " app(s), added " + appsAdded + " app(s), added " +
                newsAdded + " news article(s)" +
                (failedSources.isEmpty() ? "" : ", " + failedSources.size() + " source(s) failed");
    }
}
