package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.constants.ProviderKind;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.model.NewsArticle;
import com.contrastsecurity.appsource.provider.AssetMetadata;
import com.contrastsecurity.appsource.provider.CatalogProvider;
import com.contrastsecurity.appsource.provider.ProviderException;
import com.contrastsecurity.appsource.provider.ProviderFactory;
import com.contrastsecurity.appsource.provider.ReleaseProvider;
import com.contrastsecurity.appsource.service.IdentityResolver.ResolvedIds;
import com.contrastsecurity.appsource.util.ReleaseDates;
import com.contrastsecurity.appsource.version.VersionComparator;
import com.contrastsecurity.appsource.version.VersionParseException;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges upstream providers into a catalog.
 *
 * Configuration entries run strictly in order, so a later entry sees the apps an earlier
 * one added. Each entry is atomic: when it fails, the catalog is restored to the state it
 * had before the entry started and the run moves on. An unsupported provider kind aborts
 * the whole run.
 */
public class CatalogUpdater {
    private static final Logger logger = LoggerFactory.getLogger(CatalogUpdater.class);

    static final String BUNDLE_ID_CHANGED_NOTE = "\n\nNOTE: BundleIdentifier changed in this version and " +
            "automatic updates have been disabled until manual install occurs.";
    private static final int MAX_ERROR_DETAIL = 300;

    private final ProviderFactory providerFactory;
    private final Enricher enricher;

    /**
     * @param enricher used to backfill hashes and permissions of accepted versions, may be null
     */
    public CatalogUpdater(ProviderFactory providerFactory, Enricher enricher) {
        this.providerFactory = providerFactory;
        this.enricher = enricher;
    }

    /**
     * Run every configuration entry against the catalog.
     *
     * @throws ConfigurationException if an entry names an unsupported provider kind
     */
    public UpdateSummary run(Catalog catalog, List<ProviderConfig> configs) throws ConfigurationException {
        Diagnostics diagnostics = new Diagnostics(logger);
        diagnostics.info("Starting on {}", catalog.getName());
        int appsUpdated = 0;
        int appsAdded = 0;
        int newsAdded = 0;
        List<String> failed = new ArrayList<>();

        List<ProviderKind> kinds = new ArrayList<>();
        for (ProviderConfig config : configs) {
            kinds.add(ProviderFactory.kindOf(config));
        }

        for (int i = 0; i < configs.size(); i++) {
            ProviderConfig config = configs.get(i);
            ProviderKind kind = kinds.get(i);
            Catalog snapshot = catalog.copy();
            try {
                Counts counts = kind == ProviderKind.CATALOG
                        ? mergeCatalog(catalog, config, diagnostics)
                        : mergeRelease(catalog, config, diagnostics);
                appsUpdated += counts.updated;
                appsAdded += counts.added;
                newsAdded += counts.news;
            } catch (ConfigurationException | ProviderException | IOException e) {
                fail(catalog, snapshot, config, e, diagnostics);
                failed.add(config.describe());
            } catch (VersionParseException | JsonParseException | DateTimeParseException e) {
                fail(catalog, snapshot, config, e, diagnostics);
                failed.add(config.describe());
            } catch (RuntimeException e) {
                fail(catalog, snapshot, config, e, diagnostics);
                failed.add(config.describe());
            }
        }

        UpdateSummary summary = new UpdateSummary(appsUpdated, appsAdded, newsAdded, failed, diagnostics);
        diagnostics.info("{} app(s) updated.", appsUpdated);
        diagnostics.info("{} app(s) added, {} news article(s) added.", appsAdded, newsAdded);
        return summary;
    }

    private void fail(Catalog catalog, Catalog snapshot, ProviderConfig config, Exception e, Diagnostics diagnostics) {
        catalog.restore(snapshot);
        diagnostics.error("Unable to process {} (ids {}).", config.describe(), config.getIds());
        diagnostics.error("{}: {}", e.getClass().getSimpleName(), truncate(e.getMessage()));
        logger.debug("Failure details", e);
    }

    static String truncate(String message) {
        if (message == null) {
            return "";
        }
        String indented = message.replace("\n", "\n\t");
        return indented.length() > MAX_ERROR_DETAIL ? indented.substring(0, MAX_ERROR_DETAIL) + "..." : indented;
    }

    // ------------------------------------------------------------ catalog mirrors

    private Counts mergeCatalog(Catalog catalog, ProviderConfig config, Diagnostics diagnostics)
            throws ConfigurationException, ProviderException {
        CatalogProvider provider = (CatalogProvider) providerFactory.create(config);
        ResolvedIds ids = IdentityResolver.resolve(config.isGetAllApps() ? null : config.getIds());
        Counts counts = new Counts();

        List<App> fetched = provider.fetchApps(ids);
        List<String> missing = provider.getMissingIds();
        if (!missing.isEmpty()) {
            diagnostics.warn("Requested ids not found in {}: {}", provider.describe(), missing);
        }

        for (App app : fetched) {
            String id = app.getIdentityKey();
            int index = catalog.indexOfApp(id);
            AppVersion newVersion = app.latestVersion();

            if (index < 0) {
                catalog.getApps().add(app);
                counts.added++;
                diagnostics.info("Added {} from {}", id, provider.describe());
                if (newVersion != null) {
                    enrich(config, app, newVersion, diagnostics);
                }
                continue;
            }

            App existing = catalog.getApps().get(index);
            AppVersion current = existing.latestVersion();
            boolean accepted = false;
            if (newVersion != null && (current == null || VersionComparator.INSTANCE.compare(newVersion, current) > 0)) {
                counts.updated++;
                // only kept under the patch policy, replace swaps in the fetched app below
                existing.addVersion(newVersion);
                accepted = true;
                diagnostics.info("Updated {} to {}", id, newVersion.getVersion());
            }

            App merged;
            if (config.isPatchMerge()) {
                merged = existing;
            } else {
                if (existing.getAppID() != null) {
                    app.setAppID(existing.getAppID());
                }
                catalog.getApps().set(index, app);
                merged = app;
            }
            if (accepted) {
                enrich(config, merged, newVersion, diagnostics);
            }
        }

        if (!config.isIgnoreNews()) {
            List<String> newsFilter = config.isGetAllNews() ? null : ids.getIdentityKeys();
            for (NewsArticle article : provider.fetchNews(newsFilter)) {
                int index = catalog.indexOfArticle(article.getIdentifier());
                if (index >= 0) {
                    catalog.getNews().set(index, article);
                } else {
                    catalog.addArticle(article);
                    counts.news++;
                }
            }
        }
        return counts;
    }

    // ------------------------------------------------------------ release feeds

    private Counts mergeRelease(Catalog catalog, ProviderConfig config, Diagnostics diagnostics)
            throws ConfigurationException, ProviderException, IOException {
        List<Object> rawIds = config.getIds();
        if (rawIds == null || rawIds.size() != 1) {
            throw new ConfigurationException("Exactly one id is required for " + config.getKind() +
                    " sources, got " + (rawIds == null ? "none" : rawIds.size()));
        }
        ResolvedIds ids = IdentityResolver.resolve(rawIds);
        if (ids.size() != 1) {
            throw new ConfigurationException("Exactly one id is required for " + config.getKind() + " sources, got " + rawIds);
        }
        String identityId = ids.getIdentityKeys().get(0);
        App app = catalog.findApp(identityId);
        if (app == null) {
            app = catalog.findApp(ids.getFetchKeys().get(0));
        }
        Counts counts = new Counts();
        if (app == null) {
            diagnostics.warn("{} not found in {}. Create an app entry with this id first.", identityId, catalog.getName());
            return counts;
        }

        ReleaseProvider provider = (ReleaseProvider) providerFactory.create(config);
        AppVersion current = app.latestVersion();
        AppVersion candidate = provider.candidate();
        boolean newer = current == null || VersionComparator.INSTANCE.compare(candidate, current) > 0 ||
                config.isPreferDate() && ReleaseDates.isAfter(candidate.getDate(), current.getDate());
        if (!newer) {
            diagnostics.debug("{} is up to date at {}", identityId, current.getVersion());
            return counts;
        }

        AssetMetadata metadata = provider.fetchMetadata();
        AppVersion version = new AppVersion();
        version.setAbsoluteVersion(provider.getVersion());
        version.setDate(provider.getVersionDate());
        version.setLocalizedDescription(provider.getVersionDescription());
        version.setSize(metadata.getSize());
        version.setSha256(metadata.getSha256());
        version.setVersion(metadata.getVersion() != null ? metadata.getVersion() : provider.getVersion());
        version.setBuildVersion(metadata.getBuildVersion());
        version.setMinOSVersion(metadata.getMinOSVersion());
        version.setDownloadURL(metadata.getDownloadURL());

        if (metadata.getBundleIdentifier() == null) {
            diagnostics.warn("No bundleIdentifier found in package of {}", identityId);
        } else if (!metadata.getBundleIdentifier().equals(app.getBundleIdentifier())) {
            diagnostics.warn("{} BundleID has changed to {}", app.getName(), metadata.getBundleIdentifier());
            app.setBundleIdentifier(metadata.getBundleIdentifier());
            String description = version.getLocalizedDescription() != null ? version.getLocalizedDescription() : "";
            version.setLocalizedDescription(description + BUNDLE_ID_CHANGED_NOTE);
        }

        if (app.getAppID() == null) {
            app.setAppID(identityId);
        }
        app.addVersion(version);
        app.setAppPermissions(metadata.getPermissions());
        counts.updated++;
        diagnostics.info("Updated {} to {} from {}", identityId, version.getVersion(), provider.describe());

        if (version.getSha256() == null) {
            enrich(config, app, version, diagnostics);
        }
        return counts;
    }

    private void enrich(ProviderConfig config, App app, AppVersion version, Diagnostics diagnostics) {
        if (enricher == null || !config.isEnrich() || !Enricher.needsEnrichment(app, version, false)) {
            return;
        }
        enricher.tryEnrich(app, version, false, diagnostics);
    }

    private static final class Counts {
        int updated;
        int added;
        int news;
    }
}
