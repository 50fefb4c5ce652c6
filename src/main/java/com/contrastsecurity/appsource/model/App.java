package com.contrastsecurity.appsource.model;

import com.contrastsecurity.appsource.util.ReleaseDates;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An app listed in a catalog.
 *
 * Versions are kept newest-intent first. The list is never re-sorted: new versions
 * are inserted at the front and a version that matches an existing
 * (version, buildVersion) pair replaces it in place.
 *
 * The legacy fields ({@code version}, {@code versionDate}, {@code versionDescription},
 * {@code downloadURL}, {@code size}) belong to the first catalog schema. They are
 * mirrored from the newest version every time {@link #addVersion(AppVersion)} runs so
 * that old clients keep seeing updates.
 */
public class App {
    public static final List<String> REQUIRED_KEYS = Collections.unmodifiableList(List.of(
            "name", "bundleIdentifier", "developerName", "versions", "localizedDescription", "iconURL"));

    private String appID;
    private String bundleIdentifier;
    private String name;
    private String developerName;
    private String subtitle;
    private String localizedDescription;
    private String iconURL;
    private String tintColor;
    private Boolean beta;
    private List<AppVersion> versions = new ArrayList<>();
    private Permissions appPermissions;

    // first-generation schema
    private String legacyVersion;
    private String legacyVersionDate;
    private String legacyVersionDescription;
    private String legacyDownloadURL;
    private Long legacySize;
    private JsonArray legacyPermissions;

    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public App() {
    }

    public App(String bundleIdentifier, String name) {
        this.bundleIdentifier = bundleIdentifier;
        this.name = name;
    }

    /**
     * The key used to identify this app inside a catalog: {@code appID}, or
     * {@code bundleIdentifier} when no appID has been assigned.
     */
    public String getIdentityKey() {
        return appID != null ? appID : bundleIdentifier;
    }

    /**
     * @return the newest version by list position, or null when there are none
     */
    public AppVersion latestVersion() {
        return latestVersion(false);
    }

    /**
     * @param useDates pick the version with the latest {@code date} instead of the first one
     * @return the newest version, or null when there are none
     */
    public AppVersion latestVersion(boolean useDates) {
        if (versions == null || versions.isEmpty()) {
            return null;
        }
        if (!useDates) {
            return versions.get(0);
        }
        return Collections.max(versions, Comparator.comparing(v -> ReleaseDates.parse(v.getDate())));
    }

    /**
     * Add a version to the history.
     *
     * A version with the same (version, buildVersion) pair as an existing entry replaces
     * that entry in place; otherwise it becomes the newest entry. Either way the legacy
     * top-level fields are re-synchronized from the newest version.
     *
     * @return true if an existing entry was replaced
     */
    public boolean addVersion(AppVersion version) {
        if (versions == null) {
            versions = new ArrayList<>();
        }
        boolean replaced = false;
        for (int i = 0; i < versions.size(); i++) {
            if (versions.get(i).sameRelease(version)) {
                versions.set(i, version);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            versions.add(0, version);
        }
        syncLegacyFields();
        return replaced;
    }

    /**
     * Copy the newest version onto the first-generation top-level fields.
     */
    public void syncLegacyFields() {
        AppVersion newest = latestVersion();
        if (newest == null) {
            return;
        }
        legacyVersion = newest.getVersion();
        legacySize = newest.getSize();
        legacyDownloadURL = newest.getDownloadURL();
        legacyVersionDate = newest.getDate();
        legacyVersionDescription = newest.getLocalizedDescription();
    }

    /**
     * First-generation documents describe a single release with top-level fields.
     */
    public boolean hasLegacyVersionFields() {
        return legacyVersion != null && legacyDownloadURL != null && legacyVersionDate != null;
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (name == null) missing.add("name");
        if (bundleIdentifier == null) missing.add("bundleIdentifier");
        if (developerName == null) missing.add("developerName");
        if ((versions == null || versions.isEmpty()) && !hasLegacyVersionFields()) missing.add("versions");
        if (localizedDescription == null) missing.add("localizedDescription");
        if (iconURL == null) missing.add("iconURL");
        return missing;
    }

    /**
     * An app is valid when no required key is missing, it has at least one version and
     * all of its versions are valid (or, for old documents, the legacy version fields are
     * present) and its permissions, if any, are valid.
     */
    public boolean isValid() {
        boolean validVersions = versions != null && !versions.isEmpty();
        if (validVersions) {
            for (AppVersion version : versions) {
                if (!version.isValid()) {
                    validVersions = false;
                    break;
                }
            }
        }
        if (!validVersions) {
            validVersions = hasLegacyVersionFields();
        }
        boolean validPermissions = appPermissions == null || appPermissions.isValid();
        return validVersions && validPermissions && missingKeys().isEmpty();
    }

    public App copy() {
        App copy = new App(bundleIdentifier, name);
        copy.appID = appID;
        copy.developerName = developerName;
        copy.subtitle = subtitle;
        copy.localizedDescription = localizedDescription;
        copy.iconURL = iconURL;
        copy.tintColor = tintColor;
        copy.beta = beta;
        if (versions != null) {
            copy.versions = new ArrayList<>();
            for (AppVersion version : versions) {
                copy.versions.add(version.copy());
            }
        } else {
            copy.versions = null;
        }
        copy.appPermissions = appPermissions != null ? appPermissions.copy() : null;
        copy.legacyVersion = legacyVersion;
        copy.legacyVersionDate = legacyVersionDate;
        copy.legacyVersionDescription = legacyVersionDescription;
        copy.legacyDownloadURL = legacyDownloadURL;
        copy.legacySize = legacySize;
        copy.legacyPermissions = legacyPermissions != null ? legacyPermissions.deepCopy() : null;
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }

    public String getAppID() {
        return appID;
    }

    public void setAppID(String appID) {
        this.appID = appID;
    }

    public String getBundleIdentifier() {
        return bundleIdentifier;
    }

    public void setBundleIdentifier(String bundleIdentifier) {
        this.bundleIdentifier = bundleIdentifier;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDeveloperName() {
        return developerName;
    }

    public void setDeveloperName(String developerName) {
        this.developerName = developerName;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public void setSubtitle(String subtitle) {
        this.subtitle = subtitle;
    }

    public String getLocalizedDescription() {
        return localizedDescription;
    }

    public void setLocalizedDescription(String localizedDescription) {
        this.localizedDescription = localizedDescription;
    }

    public String getIconURL() {
        return iconURL;
    }

    public void setIconURL(String iconURL) {
        this.iconURL = iconURL;
    }

    public String getTintColor() {
        return tintColor;
    }

    public void setTintColor(String tintColor) {
        this.tintColor = tintColor;
    }

    public Boolean getBeta() {
        return beta;
    }

    public void setBeta(Boolean beta) {
        this.beta = beta;
    }

    public List<AppVersion> getVersions() {
        return versions;
    }

    /**
     * Replaces the whole history without touching the legacy fields.
     */
    public void setVersions(List<AppVersion> versions) {
        this.versions = versions;
    }

    public Permissions getAppPermissions() {
        return appPermissions;
    }

    public void setAppPermissions(Permissions appPermissions) {
        this.appPermissions = appPermissions;
    }

    public String getLegacyVersion() {
        return legacyVersion;
    }

    public void setLegacyVersion(String legacyVersion) {
        this.legacyVersion = legacyVersion;
    }

    public String getLegacyVersionDate() {
        return legacyVersionDate;
    }

    public void setLegacyVersionDate(String legacyVersionDate) {
        this.legacyVersionDate = legacyVersionDate;
    }

    public String getLegacyVersionDescription() {
        return legacyVersionDescription;
    }

    public void setLegacyVersionDescription(String legacyVersionDescription) {
        this.legacyVersionDescription = legacyVersionDescription;
    }

    public String getLegacyDownloadURL() {
        return legacyDownloadURL;
    }

    public void setLegacyDownloadURL(String legacyDownloadURL) {
        this.legacyDownloadURL = legacyDownloadURL;
    }

    public Long getLegacySize() {
        return legacySize;
    }

    public void setLegacySize(Long legacySize) {
        this.legacySize = legacySize;
    }

    /**
     * The first-generation {@code permissions} array, kept verbatim.
     */
    public JsonArray getLegacyPermissions() {
        return legacyPermissions;
    }

    public void setLegacyPermissions(JsonArray legacyPermissions) {
        this.legacyPermissions = legacyPermissions;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return name + " (" + getIdentityKey() + ")";
    }
}
