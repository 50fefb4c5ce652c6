package com.contrastsecurity.appsource.ipa;

import com.contrastsecurity.appsource.model.Permissions;

import java.nio.file.Path;

/**
 * What a package file says about itself.
 */
public class PackageMetadata {
    private Path packageFile;
    private boolean temporaryFile;
    private long size;
    private String bundleIdentifier;
    private String version;
    private String buildVersion;
    private String minOSVersion;
    private Permissions permissions;

    /**
     * The package that was inspected. For nested archives this is the extracted inner
     * package, a temporary file the caller must delete.
     */
    public Path getPackageFile() {
        return packageFile;
    }

    public void setPackageFile(Path packageFile) {
        this.packageFile = packageFile;
    }

    public boolean isTemporaryFile() {
        return temporaryFile;
    }

    public void setTemporaryFile(boolean temporaryFile) {
        this.temporaryFile = temporaryFile;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public String getBundleIdentifier() {
        return bundleIdentifier;
    }

    public void setBundleIdentifier(String bundleIdentifier) {
        this.bundleIdentifier = bundleIdentifier;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getBuildVersion() {
        return buildVersion;
    }

    public void setBuildVersion(String buildVersion) {
        this.buildVersion = buildVersion;
    }

    public String getMinOSVersion() {
        return minOSVersion;
    }

    public void setMinOSVersion(String minOSVersion) {
        this.minOSVersion = minOSVersion;
    }

    public Permissions getPermissions() {
        return permissions;
    }

    public void setPermissions(Permissions permissions) {
        this.permissions = permissions;
    }

    @Override
    public String toString() {
        return "PackageMetadata{" + bundleIdentifier + " " + version + " (" + buildVersion + "), " + size + " bytes}";
    }
}
