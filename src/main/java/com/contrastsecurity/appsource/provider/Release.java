package com.contrastsecurity.appsource.provider;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Model for a release entry, as returned by the GitHub releases API or listed in a
 * curated release feed.
 */
public class Release {
    @SerializedName("tag_name")
    private String tagName;
    private String name;
    private String body;
    private Boolean prerelease;
    @SerializedName("published_at")
    private String publishedAt;
    @SerializedName("browser_download_url")
    private String browserDownloadUrl;
    private List<Asset> assets;

    public Release() {
    }

    public Release(String tagName, String name, String body) {
        this.tagName = tagName;
        this.name = name;
        this.body = body;
    }

    public boolean isPrerelease() {
        return Boolean.TRUE.equals(prerelease);
    }

    public String getTagName() {
        return tagName;
    }

    public void setTagName(String tagName) {
        this.tagName = tagName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Boolean getPrerelease() {
        return prerelease;
    }

    public void setPrerelease(Boolean prerelease) {
        this.prerelease = prerelease;
    }

    public String getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(String publishedAt) {
        this.publishedAt = publishedAt;
    }

    /**
     * Curated feeds link the package directly from the release, possibly relative to the site.
     */
    public String getBrowserDownloadUrl() {
        return browserDownloadUrl;
    }

    public void setBrowserDownloadUrl(String browserDownloadUrl) {
        this.browserDownloadUrl = browserDownloadUrl;
    }

    public List<Asset> getAssets() {
        return assets;
    }

    public void setAssets(List<Asset> assets) {
        this.assets = assets;
    }

    @Override
    public String toString() {
        return "Release{" + tagName + (isPrerelease() ? ", prerelease" : "") + '}';
    }

    public static class Asset {
        private String name;
        @SerializedName("updated_at")
        private String updatedAt;
        @SerializedName("browser_download_url")
        private String browserDownloadUrl;
        private Long size;

        public Asset() {
        }

        public Asset(String name, String updatedAt, String browserDownloadUrl) {
            this.name = name;
            this.updatedAt = updatedAt;
            this.browserDownloadUrl = browserDownloadUrl;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUpdatedAt() {
            return updatedAt;
        }

        public void setUpdatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
        }

        public String getBrowserDownloadUrl() {
            return browserDownloadUrl;
        }

        public void setBrowserDownloadUrl(String browserDownloadUrl) {
            this.browserDownloadUrl = browserDownloadUrl;
        }

        public Long getSize() {
            return size;
        }

        public void setSize(Long size) {
            this.size = size;
        }
    }
}
