package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.config.UploadTarget;
import com.contrastsecurity.appsource.ipa.PackageInspectionException;
import com.contrastsecurity.appsource.ipa.PackageMetadata;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.service.IdentityResolver.ResolvedIds;
import com.contrastsecurity.appsource.util.ReleaseDates;
import com.contrastsecurity.appsource.version.SemanticVersion;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Shared release selection and package processing for single-project release feeds.
 */
public abstract class AbstractReleaseProvider implements ReleaseProvider {
    private static final Logger logger = LoggerFactory.getLogger(AbstractReleaseProvider.class);
    private static final Gson gson = new Gson();

    protected final ProviderConfig config;
    protected final ProviderContext context;
    protected final Release release;
    private final String version;

    protected AbstractReleaseProvider(ProviderConfig config, ProviderContext context, Release release, String version) {
        this.config = config;
        this.context = context;
        this.release = release;
        this.version = version;
    }

    /**
     * Where the package of the selected release can be downloaded.
     */
    protected abstract String getDownloadUrl();

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public String getVersionDescription() {
        String name = release.getName() != null ? release.getName() : release.getTagName();
        String body = release.getBody() != null ? release.getBody() : "";
        return "# " + name + "\n\n" + body;
    }

    public Release getRelease() {
        return release;
    }

    /**
     * A single app carrying the release as its only version. The app is identified by the
     * configured id; bundle identifier and package details are only known after
     * {@link #fetchMetadata()}.
     */
    @Override
    public List<App> fetchApps(ResolvedIds ids) {
        App app = new App();
        if (ids.isFiltered() && ids.size() == 1) {
            app.setAppID(ids.getIdentityKeys().get(0));
        }
        app.addVersion(candidate());
        app.getVersions().get(0).setLocalizedDescription(getVersionDescription());
        app.getVersions().get(0).setDownloadURL(getDownloadUrl());
        return Collections.singletonList(app);
    }

    @Override
    public AssetMetadata fetchMetadata() throws ProviderException, IOException {
        String downloadUrl = getDownloadUrl();
        Path downloaded = context.getAssetDownloader().download(downloadUrl);
        try {
            PackageMetadata metadata = context.getPackageInspector().inspect(downloaded, config.isExtractTwice());
            try {
                AssetMetadata result = new AssetMetadata();
                result.setSize(metadata.getSize());
                result.setSha256(context.getContentHasher().sha256(metadata.getPackageFile()));
                result.setBundleIdentifier(metadata.getBundleIdentifier());
                result.setVersion(metadata.getVersion());
                result.setBuildVersion(metadata.getBuildVersion());
                result.setMinOSVersion(metadata.getMinOSVersion());
                result.setPermissions(metadata.getPermissions());

                UploadTarget upload = config.getUpload();
                if (upload != null) {
                    if (context.getReleaseUploader() == null) {
                        throw new ProviderException("Upload to " + upload + " requested but no uploader is available");
                    }
                    String assetName = metadata.getBundleIdentifier() + "-" + metadata.getVersion() + ".ipa";
                    downloadUrl = context.getReleaseUploader().upload(metadata.getPackageFile(), assetName, upload);
                    logger.info("Uploaded {} to {}", assetName, downloadUrl);
                }
                result.setDownloadURL(downloadUrl);
                return result;
            } finally {
                if (metadata.isTemporaryFile()) {
                    Files.deleteIfExists(metadata.getPackageFile());
                }
            }
        } catch (PackageInspectionException e) {
            throw new ProviderException("Cannot inspect package " + downloadUrl + ": " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(downloaded);
        }
    }

    // ------------------------------------------------------------ release selection

    /**
     * Read a release listing. GitHub reports errors as an object with a {@code message}.
     */
    protected static List<Release> parseReleases(JsonElement document, String origin) throws ProviderException {
        if (document != null && document.isJsonObject() && document.getAsJsonObject().has("message")) {
            JsonElement message = document.getAsJsonObject().get("message");
            throw apiError(message.isJsonPrimitive() ? message.getAsString() : null, null);
        }
        if (document == null || !document.isJsonArray()) {
            throw new ProviderException("Malformed release list " + origin + ": not a JSON array");
        }
        try {
            Release[] releases = gson.fromJson(document, Release[].class);
            List<Release> result = new ArrayList<>();
            for (Release release : releases) {
                if (release != null) {
                    result.add(release);
                }
            }
            return result;
        } catch (JsonParseException e) {
            throw new ProviderException("Malformed release list " + origin + ": " + e.getMessage(), e);
        }
    }

    static ProviderException apiError(String message, Throwable cause) {
        if (message == null) {
            return new ProviderException("GitHub API issue", cause);
        }
        if ("Not Found".equals(message)) {
            return new ProviderException("GitHub repository not found", cause);
        }
        if (message.startsWith("API rate limit exceeded")) {
            return new ProviderException("GitHub API rate limit has been exceeded for this hour", cause);
        }
        return new ProviderException("GitHub API issue: " + message, cause);
    }

    protected static List<Release> withoutPrereleases(List<Release> releases, boolean includePrereleases)
            throws ProviderException {
        List<Release> result = new ArrayList<>();
        for (Release release : releases) {
            if (includePrereleases || !release.isPrerelease()) {
                result.add(release);
            }
        }
        if (result.isEmpty()) {
            throw new ProviderException("No matching releases found");
        }
        return result;
    }

    /**
     * The release with the highest normalized tag. Tags that do not parse as versions are
     * dropped with a warning. On equal versions the later entry wins.
     */
    protected static Release highestVersion(List<Release> releases, UnaryOperator<String> normalizer)
            throws ProviderException {
        Release best = null;
        SemanticVersion bestVersion = null;
        for (Release release : releases) {
            String tag = normalizer.apply(release.getTagName());
            if (!SemanticVersion.isValid(tag)) {
                logger.warn("Invalid version removed: {}", release.getTagName());
                continue;
            }
            SemanticVersion parsed = SemanticVersion.parse(tag);
            if (bestVersion == null || parsed.compareTo(bestVersion) >= 0) {
                best = release;
                bestVersion = parsed;
            }
        }
        if (best == null) {
            throw new ProviderException("No release with a valid version found");
        }
        return best;
    }

    /**
     * The most recently updated asset whose whole name matches {@code pattern}.
     */
    protected static Release.Asset matchAsset(Release release, Pattern pattern) throws ProviderException {
        Release.Asset best = null;
        if (release.getAssets() != null) {
            for (Release.Asset asset : release.getAssets()) {
                if (asset.getName() == null || !pattern.matcher(asset.getName()).matches()) {
                    continue;
                }
                if (best == null || !ReleaseDates.parse(asset.getUpdatedAt()).isBefore(ReleaseDates.parse(best.getUpdatedAt()))) {
                    best = asset;
                }
            }
        }
        if (best == null) {
            throw new ProviderException("No qualifying asset matching " + pattern.pattern() +
                    " in release " + release.getTagName());
        }
        return best;
    }

    protected static Pattern assetPattern(ProviderConfig config) {
        String pattern = config.getAssetPattern() != null ? config.getAssetPattern() : ProviderConfig.DEFAULT_ASSET_PATTERN;
        return Pattern.compile(pattern);
    }
}
