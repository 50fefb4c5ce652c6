package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.api.AssetDownloader;
import com.contrastsecurity.appsource.ipa.ContentHasher;
import com.contrastsecurity.appsource.ipa.PackageInspectionException;
import com.contrastsecurity.appsource.ipa.PackageInspector;
import com.contrastsecurity.appsource.ipa.PackageMetadata;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Backfills content hashes and permissions by downloading and inspecting a version's package.
 */
public class Enricher {
    private static final Logger logger = LoggerFactory.getLogger(Enricher.class);

    private final AssetDownloader downloader;
    private final PackageInspector inspector;
    private final ContentHasher hasher;

    public Enricher(AssetDownloader downloader, PackageInspector inspector, ContentHasher hasher) {
        this.downloader = downloader;
        this.inspector = inspector;
        this.hasher = hasher;
    }

    public static boolean needsEnrichment(App app, AppVersion version, boolean force) {
        return force || version.getSha256() == null || app.getAppPermissions() == null;
    }

    /**
     * Fill in {@code sha256} and {@code size} of the version and the app's permissions where
     * they are missing, or unconditionally when {@code force} is set.
     *
     * @return true if the package was downloaded
     * @throws EnrichmentException if the package cannot be downloaded or inspected
     */
    public boolean enrich(App app, AppVersion version, boolean force) throws EnrichmentException {
        if (!needsEnrichment(app, version, force)) {
            return false;
        }
        process(app, version, force, true);
        return true;
    }

    /**
     * Fill in only {@code sha256} and {@code size}. Used for older versions, whose packages
     * say nothing about the app's current permissions.
     */
    public boolean enrichHash(App app, AppVersion version, boolean force) throws EnrichmentException {
        if (!force && version.getSha256() != null) {
            return false;
        }
        process(app, version, force, false);
        return true;
    }

    private void process(App app, AppVersion version, boolean force, boolean withPermissions) throws EnrichmentException {
        if (version.getDownloadURL() == null) {
            throw new EnrichmentException("Version " + version.getVersion() + " of " + app.getIdentityKey() +
                    " has no download URL", null);
        }
        Path downloaded = null;
        try {
            downloaded = downloader.download(version.getDownloadURL());
            if (force || version.getSha256() == null) {
                version.setSha256(hasher.sha256(downloaded));
                logger.debug("Computed sha256 of {} {}", app.getIdentityKey(), version.getVersion());
            }
            if (version.getSize() == null) {
                version.setSize(Files.size(downloaded));
            }
            if (withPermissions && (force || app.getAppPermissions() == null)) {
                PackageMetadata metadata = inspector.inspect(downloaded, false);
                app.setAppPermissions(metadata.getPermissions());
            }
        } catch (IOException | PackageInspectionException e) {
            throw new EnrichmentException("Unable to enrich " + app.getIdentityKey() + " " + version.getVersion() +
                    " from " + version.getDownloadURL() + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(downloaded);
        }
    }

    /**
     * Like {@link #enrich(App, AppVersion, boolean)}, reporting failure as a warning.
     * The version keeps its missing fields for a later attempt.
     */
    public boolean tryEnrich(App app, AppVersion version, boolean force, Diagnostics diagnostics) {
        try {
            return enrich(app, version, force);
        } catch (EnrichmentException e) {
            diagnostics.warn("{}", e.getMessage());
            return false;
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Unable to clean up temporary file {}: {}", file, e.getMessage());
        }
    }
}
