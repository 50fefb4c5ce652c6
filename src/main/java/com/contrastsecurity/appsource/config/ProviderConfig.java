package com.contrastsecurity.appsource.config;

import com.contrastsecurity.appsource.version.TagNormalizer;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One entry of the {@code sources} list: which provider to run and how to merge its results.
 *
 * Not every option applies to every kind. Catalog mirrors use {@code source},
 * {@code getAllApps}, {@code getAllNews}, {@code ignoreNews} and {@code mergePolicy};
 * release feeds use the release and asset selection options.
 */
public class ProviderConfig {
    public static final String MERGE_REPLACE = "replace";
    public static final String MERGE_PATCH = "patch";
    public static final String DEFAULT_ASSET_PATTERN = ".*\\.ipa";

    private String kind;

    // where to read from
    private String source;
    private String url;
    private String owner;
    private String repo;
    private String baseUrl;

    /** Plain id strings or single-entry {appID: bundleIdentifier} maps. */
    private List<Object> ids;

    // catalog mirrors
    private boolean getAllApps;
    private boolean getAllNews;
    private boolean ignoreNews;
    private String mergePolicy = MERGE_REPLACE;

    // release feeds
    private boolean includePrereleases;
    private boolean preferDate;
    private String assetPattern = DEFAULT_ASSET_PATTERN;
    private boolean extractTwice;
    private String tagPrefix = "v";
    private TagRewrite tagRewrite;
    private UploadTarget upload;

    private boolean enrich = true;

    public ProviderConfig() {
    }

    public ProviderConfig(String kind) {
        this.kind = kind;
    }

    /**
     * Compile the asset pattern and tag rewrite up front so a bad regex surfaces as a
     * configuration error of this entry.
     *
     * @throws ConfigurationException if either pattern is not a valid regex
     */
    public void validatePatterns() throws ConfigurationException {
        compile("assetPattern", assetPattern);
        if (tagRewrite != null) {
            compile("tagRewrite.pattern", tagRewrite.getPattern());
        }
    }

    private static void compile(String option, String regex) throws ConfigurationException {
        if (regex == null) {
            return;
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid " + option + " '" + regex + "': " + e.getDescription(), e);
        }
    }

    public TagNormalizer tagNormalizer() {
        if (tagRewrite == null || tagRewrite.getPattern() == null) {
            return TagNormalizer.stripLeading(tagPrefix);
        }
        return TagNormalizer.of(tagPrefix, tagRewrite.getPattern(), tagRewrite.getReplacement());
    }

    public boolean isPatchMerge() {
        return MERGE_PATCH.equalsIgnoreCase(mergePolicy);
    }

    /**
     * Short human readable description used in logs and summaries.
     */
    public String describe() {
        String location;
        if (source != null) {
            location = source;
        } else if (url != null) {
            location = url;
        } else if (owner != null || repo != null) {
            location = owner + "/" + repo;
        } else {
            location = "?";
        }
        return kind + " " + location;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public List<Object> getIds() {
        return ids;
    }

    public void setIds(List<Object> ids) {
        this.ids = ids;
    }

    public boolean isGetAllApps() {
        return getAllApps;
    }

    public void setGetAllApps(boolean getAllApps) {
        this.getAllApps = getAllApps;
    }

    public boolean isGetAllNews() {
        return getAllNews;
    }

    public void setGetAllNews(boolean getAllNews) {
        this.getAllNews = getAllNews;
    }

    public boolean isIgnoreNews() {
        return ignoreNews;
    }

    public void setIgnoreNews(boolean ignoreNews) {
        this.ignoreNews = ignoreNews;
    }

    public String getMergePolicy() {
        return mergePolicy;
    }

    public void setMergePolicy(String mergePolicy) {
        this.mergePolicy = mergePolicy;
    }

    public boolean isIncludePrereleases() {
        return includePrereleases;
    }

    public void setIncludePrereleases(boolean includePrereleases) {
        this.includePrereleases = includePrereleases;
    }

    public boolean isPreferDate() {
        return preferDate;
    }

    public void setPreferDate(boolean preferDate) {
        this.preferDate = preferDate;
    }

    public String getAssetPattern() {
        return assetPattern;
    }

    public void setAssetPattern(String assetPattern) {
        this.assetPattern = assetPattern;
    }

    public boolean isExtractTwice() {
        return extractTwice;
    }

    public void setExtractTwice(boolean extractTwice) {
        this.extractTwice = extractTwice;
    }

    public String getTagPrefix() {
        return tagPrefix;
    }

    public void setTagPrefix(String tagPrefix) {
        this.tagPrefix = tagPrefix;
    }

    public TagRewrite getTagRewrite() {
        return tagRewrite;
    }

    public void setTagRewrite(TagRewrite tagRewrite) {
        this.tagRewrite = tagRewrite;
    }

    public UploadTarget getUpload() {
        return upload;
    }

    public void setUpload(UploadTarget upload) {
        this.upload = upload;
    }

    public boolean isEnrich() {
        return enrich;
    }

    public void setEnrich(boolean enrich) {
        this.enrich = enrich;
    }

    @Override
    public String toString() {
        return "ProviderConfig{" + describe() + ", ids=" + ids + '}';
    }
}
