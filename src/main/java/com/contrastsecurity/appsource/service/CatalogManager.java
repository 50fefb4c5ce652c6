package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.ipa.PackageInspectionException;
import com.contrastsecurity.appsource.ipa.PackageMetadata;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.provider.ProviderContext;
import com.contrastsecurity.appsource.provider.ProviderFactory;
import com.contrastsecurity.appsource.util.CatalogJson;
import com.contrastsecurity.appsource.util.ReleaseDates;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maintains one catalog document: adding apps, running updates, backfilling derived
 * fields, applying hand-written overrides and saving.
 */
public class CatalogManager {
    private static final Logger logger = LoggerFactory.getLogger(CatalogManager.class);

    static final String PLACEHOLDER_NAME = "Example App";
    static final String PLACEHOLDER_DEVELOPER = "Example.com";
    static final String PLACEHOLDER_DESCRIPTION = "An app that is an example.";
    static final String PLACEHOLDER_ICON = "https://example.com/icon.png";

    private final Catalog catalog;
    private final Path path;
    private final ProviderContext context;
    private final Enricher enricher;

    /**
     * @param path where {@link #save(boolean)} writes, may be null
     */
    public CatalogManager(Catalog catalog, Path path, ProviderContext context) {
        this.catalog = catalog;
        this.path = path;
        this.context = context;
        this.enricher = new Enricher(context.getAssetDownloader(), context.getPackageInspector(), context.getContentHasher());
    }

    public static CatalogManager load(Path path, ProviderContext context) throws IOException {
        return new CatalogManager(CatalogJson.load(path), path, context);
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Create an app entry from a package file. Name, developer, description and icon get
     * placeholder values to be edited by hand.
     *
     * @param downloadURL public URL of the package; when {@code packagePath} is null the package is downloaded from here
     * @param packagePath local copy of the package, may be null
     */
    public App buildAppFromPackage(String downloadURL, Path packagePath) throws IOException, PackageInspectionException {
        if (downloadURL == null || downloadURL.isEmpty()) {
            logger.warn("Users will be unable to download the app until a valid download url is set.");
        }
        Path packageFile = packagePath;
        boolean downloaded = false;
        if (packageFile == null) {
            if (downloadURL == null || downloadURL.isEmpty()) {
                throw new IOException("Either a package file or a download url is required");
            }
            packageFile = context.getAssetDownloader().download(downloadURL);
            downloaded = true;
        }
        try {
            PackageMetadata metadata = context.getPackageInspector().inspect(packageFile, false);

            AppVersion version = new AppVersion(metadata.getVersion(), ReleaseDates.now(),
                    downloadURL != null ? downloadURL : "", metadata.getSize());
            version.setSha256(context.getContentHasher().sha256(packageFile));
            version.setBuildVersion(metadata.getBuildVersion());
            version.setMinOSVersion(metadata.getMinOSVersion());

            App app = new App(metadata.getBundleIdentifier(), PLACEHOLDER_NAME);
            app.setDeveloperName(PLACEHOLDER_DEVELOPER);
            app.setLocalizedDescription(PLACEHOLDER_DESCRIPTION);
            app.setIconURL(PLACEHOLDER_ICON);
            app.setAppPermissions(metadata.getPermissions());
            if (metadata.getBundleIdentifier() == null) {
                logger.warn("No bundleIdentifier found in package {}", packageFile.getFileName());
            }
            app.addVersion(version);
            return app;
        } finally {
            if (downloaded) {
                Files.deleteIfExists(packageFile);
            }
        }
    }

    /**
     * Append an app. An app without an appID gets its bundle identifier as appID.
     * Invalid apps and apps whose id is already present are rejected.
     */
    public AddResult addApp(App app) {
        if (app == null) {
            logger.error("No app added.");
            return AddResult.rejected("No app given");
        }
        if (app.getAppID() == null) {
            app.setAppID(app.getBundleIdentifier());
        }
        if (!app.isValid()) {
            logger.error("App is invalid, missing {}", app.missingKeys());
            return AddResult.rejected("App is invalid");
        }
        if (catalog.indexOfApp(app.getAppID()) >= 0) {
            logger.error("Could not add app. {} already exists in {}", app.getAppID(), catalog.getName());
            return AddResult.rejected("App id already exists: " + app.getAppID());
        }
        catalog.getApps().add(app);
        logger.info("Adding {} to {}", app.getName(), catalog.getName());
        return AddResult.added();
    }

    /**
     * @throws ConfigurationException if a source names an unsupported provider kind
     */
    public UpdateSummary runUpdate(List<ProviderConfig> configs) throws ConfigurationException {
        CatalogUpdater updater = new CatalogUpdater(new ProviderFactory(context), enricher);
        return updater.run(catalog, configs);
    }

    /**
     * Compute missing hashes (and permissions of the latest version).
     *
     * @param onlyLatest only look at each app's newest version
     * @param force recompute even where values are present
     */
    public Diagnostics backfillHashesAndPermissions(boolean onlyLatest, boolean force) {
        Diagnostics diagnostics = new Diagnostics(logger);
        for (App app : catalog.getApps()) {
            AppVersion latest = app.latestVersion();
            if (latest == null) {
                continue;
            }
            if (Enricher.needsEnrichment(app, latest, force)) {
                diagnostics.debug("Updating {} sha256 checksum.", app.getName());
                enricher.tryEnrich(app, latest, force, diagnostics);
            }
            if (onlyLatest) {
                continue;
            }
            for (AppVersion version : app.getVersions()) {
                if (version == latest) {
                    continue;
                }
                try {
                    enricher.enrichHash(app, version, force);
                } catch (EnrichmentException e) {
                    diagnostics.warn("{}", e.getMessage());
                }
            }
        }
        return diagnostics;
    }

    /**
     * Merge hand-written JSON fragments over apps, keyed by app id. Keys are written as
     * given, so the fragment bypasses validation; the app is re-read afterwards.
     */
    public Diagnostics applyManualOverrides(Map<String, JsonObject> overrides) {
        Diagnostics diagnostics = new Diagnostics(logger);
        if (overrides == null) {
            return diagnostics;
        }
        List<String> unmatched = new ArrayList<>(overrides.keySet());
        List<App> apps = catalog.getApps();
        for (int i = 0; i < apps.size(); i++) {
            String id = apps.get(i).getIdentityKey();
            JsonObject patch = overrides.get(id);
            if (patch == null) {
                continue;
            }
            unmatched.remove(id);
            JsonObject json = CatalogJson.toJson(apps.get(i), true);
            for (Map.Entry<String, JsonElement> entry : patch.entrySet()) {
                json.add(entry.getKey(), entry.getValue().deepCopy());
            }
            apps.set(i, CatalogJson.parseApp(json));
            diagnostics.debug("Applied override to {}: {}", id, patch.keySet());
        }
        for (String id : unmatched) {
            diagnostics.warn("Override for {} does not match any app", id);
        }
        return diagnostics;
    }

    /**
     * Save to the path the catalog was loaded from, including extension fields.
     */
    public void save(boolean pretty) throws IOException {
        save(null, pretty, true);
    }

    /**
     * @param target where to write, null for the path the catalog was loaded from
     * @param pretty two-space indentation, otherwise minified
     * @param fullDocument include extension fields, otherwise only the known schema
     */
    public void save(Path target, boolean pretty, boolean fullDocument) throws IOException {
        Path destination = target != null ? target : path;
        if (destination == null) {
            throw new IOException("No output path given for " + catalog.getName());
        }
        CatalogJson.write(catalog, destination, pretty, fullDocument);
        logger.info("Saved {} to {}", catalog.getName(), destination);
    }
}
