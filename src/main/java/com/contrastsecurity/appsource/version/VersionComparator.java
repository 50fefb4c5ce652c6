package com.contrastsecurity.appsource.version;

import com.contrastsecurity.appsource.model.AppVersion;

import java.util.Comparator;

/**
 * Orders catalog versions.
 *
 * <ol>
 *   <li>When both sides carry an {@code absoluteVersion}, those decide and nothing else is looked at.</li>
 *   <li>Otherwise the display {@code version} decides.</li>
 *   <li>On a tie, {@code buildVersion} decides if both sides have one.</li>
 *   <li>Anything else is a tie.</li>
 * </ol>
 *
 * Two different artifacts with the same display version and no build information compare
 * as equal. Malformed version strings surface as {@link VersionParseException}.
 */
public final class VersionComparator implements Comparator<AppVersion> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {
    }

    @Override
    public int compare(AppVersion left, AppVersion right) {
        if (left.getAbsoluteVersion() != null && right.getAbsoluteVersion() != null) {
            return SemanticVersion.compare(left.getAbsoluteVersion(), right.getAbsoluteVersion());
        }
        int result = SemanticVersion.compare(left.getVersion(), right.getVersion());
        if (result == 0 && left.getBuildVersion() != null && right.getBuildVersion() != null) {
            result = SemanticVersion.compare(left.getBuildVersion(), right.getBuildVersion());
        }
        return result;
    }

    /**
     * Compare display versions only, ignoring absolute and build versions.
     */
    public static int compareDisplay(AppVersion left, AppVersion right) {
        return SemanticVersion.compare(left.getVersion(), right.getVersion());
    }
}
