package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.api.DocumentFetcher;
import com.contrastsecurity.appsource.api.HttpStatusException;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.model.NewsArticle;
import com.contrastsecurity.appsource.service.IdentityResolver.ResolvedIds;
import com.contrastsecurity.appsource.util.CatalogJson;
import com.contrastsecurity.appsource.version.VersionComparator;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors apps and news out of another catalog document.
 */
public class CatalogMirrorProvider implements CatalogProvider {
    private static final Logger logger = LoggerFactory.getLogger(CatalogMirrorProvider.class);

    private final String source;
    private final Catalog catalog;
    private final List<String> missingIds = new ArrayList<>();

    CatalogMirrorProvider(String source, Catalog catalog) {
        this.source = source;
        this.catalog = catalog;
    }

    /**
     * Load the catalog at {@code source}, a file path or URL.
     *
     * @throws ProviderException if the document cannot be loaded or lacks its own name and identifier
     */
    public static CatalogMirrorProvider open(String source, DocumentFetcher fetcher) throws ProviderException {
        if (source == null || source.isEmpty()) {
            throw new ProviderException("Catalog mirror has no source");
        }
        JsonElement document;
        try {
            document = fetcher.fetch(source);
        } catch (NoSuchFileException e) {
            throw new ProviderException("Catalog not found: " + source, e);
        } catch (HttpStatusException e) {
            if (e.isNotFound()) {
                throw new ProviderException("Catalog not found: " + source, e);
            }
            throw new ProviderException("Cannot load catalog " + source + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException("Cannot load catalog " + source + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ProviderException("Malformed catalog " + source + ": " + e.getMessage(), e);
        }
        if (document == null || !document.isJsonObject()) {
            throw new ProviderException("Malformed catalog " + source + ": not a JSON object");
        }
        Catalog catalog = CatalogJson.parseCatalog(document.getAsJsonObject());
        if (!catalog.missingKeys().isEmpty()) {
            throw new ProviderException("Invalid catalog " + source + ", missing " + catalog.missingKeys());
        }
        logger.debug("Loaded catalog {} ({} apps) from {}", catalog.getName(), catalog.getApps().size(), source);
        return new CatalogMirrorProvider(source, catalog);
    }

    /**
     * Valid apps whose {@code appID} (or bundle identifier) passes the filter.
     *
     * When the document lists the same app more than once, the entry with the higher display
     * version is kept; on a tie the later entry wins. Kept apps without an appID get one: the
     * bundle identifier when it was requested as a plain id, or the remapped appID otherwise.
     * Returned apps are copies.
     */
    @Override
    public List<App> fetchApps(ResolvedIds ids) {
        Map<String, App> selected = new LinkedHashMap<>();
        for (App app : catalog.getApps()) {
            if (!app.isValid()) {
                logger.warn("Failed to parse invalid app: {}", app.getName());
                continue;
            }
            String key = app.getIdentityKey();
            App previous = selected.get(key);
            if (previous != null) {
                if (isNewer(previous, app)) {
                    continue;
                }
            } else if (!ids.accepts(key)) {
                continue;
            }
            App copy = app.copy();
            if (copy.getAppID() == null) {
                copy.setAppID(ids.appIdFor(copy.getBundleIdentifier()));
            }
            selected.put(key, copy);
        }

        missingIds.clear();
        if (ids.isFiltered()) {
            for (String id : ids.getFetchKeys()) {
                if (!selected.containsKey(id) && !missingIds.contains(id)) {
                    missingIds.add(id);
                }
            }
            if (!missingIds.isEmpty()) {
                logger.debug("Requested ids not found in catalog ({}): {}", catalog.getName(), missingIds);
            }
        }
        return new ArrayList<>(selected.values());
    }

    private static boolean isNewer(App kept, App candidate) {
        AppVersion keptVersion = kept.latestVersion();
        AppVersion candidateVersion = candidate.latestVersion();
        if (keptVersion == null || candidateVersion == null) {
            return keptVersion != null;
        }
        return VersionComparator.compareDisplay(keptVersion, candidateVersion) > 0;
    }

    @Override
    public List<String> getMissingIds() {
        return new ArrayList<>(missingIds);
    }

    /**
     * Valid articles whose identifier or app reference is listed, or all valid articles
     * when {@code ids} is null. Returned articles are copies.
     */
    @Override
    public List<NewsArticle> fetchNews(List<String> ids) {
        List<NewsArticle> result = new ArrayList<>();
        if (catalog.getNews() == null) {
            return result;
        }
        for (NewsArticle article : catalog.getNews()) {
            if (!article.isValid()) {
                logger.debug("Skipping invalid news article: {}", article.getIdentifier());
                continue;
            }
            if (ids == null || ids.contains(article.getIdentifier()) ||
                    article.getAppID() != null && ids.contains(article.getAppID())) {
                result.add(article.copy());
            }
        }
        return result;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    @Override
    public String describe() {
        return source;
    }
}
