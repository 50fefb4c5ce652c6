package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.api.HttpStatusException;
import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.util.ReleaseDates;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Resolves the newest release of a project that publishes its own flat JSON release list.
 *
 * Each entry carries {@code tag_name}, {@code published_at}, {@code name}, {@code body} and
 * a {@code browser_download_url} that may be relative to {@code baseUrl}. Entries may
 * instead list {@code assets} the way GitHub does.
 */
public class CuratedFeedProvider extends AbstractReleaseProvider {
    private static final Logger logger = LoggerFactory.getLogger(CuratedFeedProvider.class);

    private final String url;
    private final String downloadUrl;

    CuratedFeedProvider(ProviderConfig config, ProviderContext context, String url,
                        Release release, String version, String downloadUrl) {
        super(config, context, release, version);
        this.url = url;
        this.downloadUrl = downloadUrl;
    }

    public static CuratedFeedProvider open(ProviderConfig config, ProviderContext context)
            throws ProviderException, ConfigurationException {
        String url = config.getUrl() != null ? config.getUrl() : config.getSource();
        if (url == null) {
            throw new ConfigurationException("A release list url is required");
        }

        JsonElement document;
        try {
            document = context.getDocumentFetcher().fetch(url);
        } catch (HttpStatusException e) {
            if (e.isNotFound()) {
                throw new ProviderException("Release list not found: " + url, e);
            }
            throw new ProviderException("Cannot load releases from " + url + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException("Cannot load releases from " + url + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ProviderException("Malformed release list " + url + ": " + e.getMessage(), e);
        }
        List<Release> releases = withoutPrereleases(parseReleases(document, url), config.isIncludePrereleases());

        Release selected;
        if (config.isPreferDate()) {
            selected = null;
            for (Release release : releases) {
                if (release.getPublishedAt() == null) {
                    continue;
                }
                if (selected == null || !ReleaseDates.parse(release.getPublishedAt()).isBefore(ReleaseDates.parse(selected.getPublishedAt()))) {
                    selected = release;
                }
            }
            if (selected == null) {
                throw new ProviderException("No release with a publish date in " + url);
            }
        } else {
            selected = highestVersion(releases, config.tagNormalizer());
        }

        String link = selected.getBrowserDownloadUrl();
        if (link == null) {
            link = matchAsset(selected, assetPattern(config)).getBrowserDownloadUrl();
        }
        String version = config.tagNormalizer().apply(selected.getTagName());
        String resolved = resolve(config.getBaseUrl(), link);
        logger.debug("Selected release {} ({}) from {}", version, resolved, url);
        return new CuratedFeedProvider(config, context, url, selected, version, resolved);
    }

    /**
     * Resolve a possibly relative download link against the site it was published on.
     */
    static String resolve(String baseUrl, String link) throws ProviderException {
        if (link == null) {
            throw new ProviderException("Release has no download url");
        }
        if (link.startsWith("http://") || link.startsWith("https://") || baseUrl == null) {
            return link;
        }
        try {
            String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
            return URI.create(base).resolve(link.startsWith("/") ? link.substring(1) : link).toString();
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Cannot resolve download url " + link + " against " + baseUrl, e);
        }
    }

    @Override
    public String getVersionDate() {
        return release.getPublishedAt();
    }

    @Override
    protected String getDownloadUrl() {
        return downloadUrl;
    }

    @Override
    public String describe() {
        return url;
    }
}
