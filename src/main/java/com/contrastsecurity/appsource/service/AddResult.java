package com.contrastsecurity.appsource.service;

/**
 * Outcome of adding an app to a catalog by hand.
 */
public class AddResult {
    private final boolean added;
    private final String reason;

    private AddResult(boolean added, String reason) {
        this.added = added;
        this.reason = reason;
    }

    public static AddResult added() {
        return new AddResult(true, null);
    }

    public static AddResult rejected(String reason) {
        return new AddResult(false, reason);
    }

    public boolean isAdded() {
        return added;
    }

    /**
     * Why the app was rejected, null when it was added.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return added ? "added" : "rejected: " + reason;
    }
}
