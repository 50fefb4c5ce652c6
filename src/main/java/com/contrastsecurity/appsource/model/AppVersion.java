package com.contrastsecurity.appsource.model;

import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One downloadable release of an app.
 *
 * {@code absoluteVersion} is not part of the public catalog schema. When both sides of
 * a comparison carry it, it overrides {@code version} for ordering (see
 * {@link com.contrastsecurity.appsource.version.VersionComparator}).
 */
public class AppVersion {
    public static final List<String> REQUIRED_KEYS =
            Collections.unmodifiableList(List.of("version", "date", "downloadURL", "size"));

    private String version;
    private String absoluteVersion;
    private String buildVersion;
    private String date;
    private String localizedDescription;
    private String downloadURL;
    private Long size;
    private String sha256;
    private String minOSVersion;
    private String maxOSVersion;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public AppVersion() {
    }

    public AppVersion(String version, String date, String downloadURL, Long size) {
        this.version = version;
        this.date = date;
        this.downloadURL = downloadURL;
        this.size = size;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getAbsoluteVersion() {
        return absoluteVersion;
    }

    public void setAbsoluteVersion(String absoluteVersion) {
        this.absoluteVersion = absoluteVersion;
    }

    public String getBuildVersion() {
        return buildVersion;
    }

    public void setBuildVersion(String buildVersion) {
        this.buildVersion = buildVersion;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getLocalizedDescription() {
        return localizedDescription;
    }

    public void setLocalizedDescription(String localizedDescription) {
        this.localizedDescription = localizedDescription;
    }

    public String getDownloadURL() {
        return downloadURL;
    }

    public void setDownloadURL(String downloadURL) {
        this.downloadURL = downloadURL;
    }

    public Long getSize() {
        return size;
    }

    public void setSize(Long size) {
        this.size = size;
    }

    public String getSha256() {
        return sha256;
    }

    public void setSha256(String sha256) {
        this.sha256 = sha256;
    }

    public String getMinOSVersion() {
        return minOSVersion;
    }

    public void setMinOSVersion(String minOSVersion) {
        this.minOSVersion = minOSVersion;
    }

    public String getMaxOSVersion() {
        return maxOSVersion;
    }

    public void setMaxOSVersion(String maxOSVersion) {
        this.maxOSVersion = maxOSVersion;
    }

    /**
     * Keys this model does not know about, in document order.
     */
    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    /**
     * Two versions occupy the same slot in an app's history when both their
     * display version and build version match.
     */
    public boolean sameRelease(AppVersion other) {
        return other != null &&
                Objects.equals(version, other.version) &&
                Objects.equals(buildVersion, other.buildVersion);
    }

    /**
     * @return the required keys that have no value, empty when the version is complete
     */
    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (version == null) missing.add("version");
        if (date == null) missing.add("date");
        if (downloadURL == null) missing.add("downloadURL");
        if (size == null) missing.add("size");
        return missing;
    }

    public boolean isValid() {
        return missingKeys().isEmpty();
    }

    public AppVersion copy() {
        AppVersion copy = new AppVersion(version, date, downloadURL, size);
        copy.absoluteVersion = absoluteVersion;
        copy.buildVersion = buildVersion;
        copy.localizedDescription = localizedDescription;
        copy.sha256 = sha256;
        copy.minOSVersion = minOSVersion;
        copy.maxOSVersion = maxOSVersion;
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }

    @Override
    public String toString() {
        return version + (buildVersion != null ? " (" + buildVersion + ")" : "");
    }
}
