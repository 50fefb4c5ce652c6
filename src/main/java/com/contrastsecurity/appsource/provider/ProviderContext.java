package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.api.AssetDownloader;
import com.contrastsecurity.appsource.api.DocumentFetcher;
import com.contrastsecurity.appsource.api.ReleaseUploader;
import com.contrastsecurity.appsource.ipa.ContentHasher;
import com.contrastsecurity.appsource.ipa.PackageInspector;

/**
 * The collaborators providers use to reach the outside world.
 */
public class ProviderContext {
    private final DocumentFetcher documentFetcher;
    private final AssetDownloader assetDownloader;
    private final PackageInspector packageInspector;
    private final ContentHasher contentHasher;
    private final ReleaseUploader releaseUploader;

    public ProviderContext(DocumentFetcher documentFetcher, AssetDownloader assetDownloader,
                           PackageInspector packageInspector, ContentHasher contentHasher,
                           ReleaseUploader releaseUploader) {
        this.documentFetcher = documentFetcher;
        this.assetDownloader = assetDownloader;
        this.packageInspector = packageInspector;
        this.contentHasher = contentHasher;
        this.releaseUploader = releaseUploader;
    }

    public DocumentFetcher getDocumentFetcher() {
        return documentFetcher;
    }

    public AssetDownloader getAssetDownloader() {
        return assetDownloader;
    }

    public PackageInspector getPackageInspector() {
        return packageInspector;
    }

    public ContentHasher getContentHasher() {
        return contentHasher;
    }

    public ReleaseUploader getReleaseUploader() {
        return releaseUploader;
    }
}
