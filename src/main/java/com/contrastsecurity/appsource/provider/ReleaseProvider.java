package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.model.AppVersion;

import java.io.IOException;

/**
 * A provider that resolves the single newest qualifying release of one upstream project.
 */
public interface ReleaseProvider extends AppProvider {

    /** The normalized release tag. */
    String getVersion();

    String getVersionDate();

    String getVersionDescription();

    /**
     * The release as a version candidate for comparison, without package metadata.
     */
    default AppVersion candidate() {
        AppVersion candidate = new AppVersion();
        candidate.setAbsoluteVersion(getVersion());
        candidate.setVersion(getVersion());
        candidate.setDate(getVersionDate());
        return candidate;
    }

    /**
     * Download and inspect the release's package, re-uploading it first when configured.
     */
    AssetMetadata fetchMetadata() throws ProviderException, IOException;
}
