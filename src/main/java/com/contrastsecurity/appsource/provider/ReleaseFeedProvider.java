package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.api.HttpStatusException;
import com.contrastsecurity.appsource.api.UpstreamClient;
import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.util.ReleaseDates;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves the newest qualifying GitHub release of one repository.
 *
 * With {@code preferDate} the release whose matching asset was updated last wins;
 * otherwise the release with the highest normalized tag wins. Pre-releases are skipped
 * unless {@code includePrereleases} is set.
 */
public class ReleaseFeedProvider extends AbstractReleaseProvider {
    private static final Logger logger = LoggerFactory.getLogger(ReleaseFeedProvider.class);

    private final Release.Asset asset;
    private final String url;

    ReleaseFeedProvider(ProviderConfig config, ProviderContext context, String url,
                        Release release, String version, Release.Asset asset) {
        super(config, context, release, version);
        this.url = url;
        this.asset = asset;
    }

    /**
     * Fetch the release listing and select a release and asset.
     *
     * @throws ConfigurationException if neither {@code url} nor {@code owner}/{@code repo} is configured
     * @throws ProviderException if the listing cannot be loaded or nothing qualifies
     */
    public static ReleaseFeedProvider open(ProviderConfig config, ProviderContext context)
            throws ProviderException, ConfigurationException {
        String url = config.getUrl();
        if (url == null) {
            if (config.getOwner() == null || config.getRepo() == null) {
                throw new ConfigurationException("Either the api url or both the repo owner and name are required");
            }
            url = UpstreamClient.releasesUrl(config.getOwner(), config.getRepo());
        }

        JsonElement document;
        try {
            document = context.getDocumentFetcher().fetch(url);
        } catch (HttpStatusException e) {
            throw e.isNotFound() ? apiError("Not Found", e) : apiError(e.getApiMessage(), e);
        } catch (IOException e) {
            throw new ProviderException("Cannot load releases from " + url + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ProviderException("Malformed release list " + url + ": " + e.getMessage(), e);
        }
        List<Release> releases = withoutPrereleases(parseReleases(document, url), config.isIncludePrereleases());
        Pattern pattern = assetPattern(config);

        Release selected;
        Release.Asset asset;
        if (config.isPreferDate()) {
            selected = null;
            asset = null;
            for (Release release : releases) {
                Release.Asset candidate;
                try {
                    candidate = matchAsset(release, pattern);
                } catch (ProviderException e) {
                    logger.debug("Skipping release {}: {}", release.getTagName(), e.getMessage());
                    continue;
                }
                if (asset == null || !ReleaseDates.parse(candidate.getUpdatedAt()).isBefore(ReleaseDates.parse(asset.getUpdatedAt()))) {
                    selected = release;
                    asset = candidate;
                }
            }
            if (selected == null) {
                throw new ProviderException("No qualifying asset matching " + pattern.pattern() + " in any release of " + url);
            }
        } else {
            selected = highestVersion(releases, config.tagNormalizer());
            asset = matchAsset(selected, pattern);
        }

        String version = config.tagNormalizer().apply(selected.getTagName());
        logger.debug("Selected release {} (asset {}) from {}", version, asset.getName(), url);
        return new ReleaseFeedProvider(config, context, url, selected, version, asset);
    }

    public Release.Asset getAsset() {
        return asset;
    }

    /**
     * The update time of the selected asset.
     */
    @Override
    public String getVersionDate() {
        return asset.getUpdatedAt();
    }

    @Override
    protected String getDownloadUrl() {
        return asset.getBrowserDownloadUrl();
    }

    @Override
    public String describe() {
        return url;
    }
}
