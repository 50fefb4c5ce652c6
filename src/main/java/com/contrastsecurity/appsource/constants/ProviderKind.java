package com.contrastsecurity.appsource.constants;

/**
 * Supported upstream provider kinds.
 */
public enum ProviderKind {
    /** Another catalog document, mirrored and filtered. */
    CATALOG("catalog"),
    /** GitHub releases of one repository. */
    GITHUB("github"),
    /** A flat JSON list of releases published by a project. */
    RELEASES("releases");

    private final String value;

    ProviderKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get ProviderKind from string value.
     *
     * @param value String representation
     * @return ProviderKind enum or null if not found
     */
    public static ProviderKind fromString(String value) {
        if (value == null) {
            return null;
        }
        for (ProviderKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
