package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.TestFixtures;
import com.contrastsecurity.appsource.TestFixtures.FakeAssetDownloader;
import com.contrastsecurity.appsource.TestFixtures.FakeDocumentFetcher;
import com.contrastsecurity.appsource.TestFixtures.FakePackageInspector;
import com.contrastsecurity.appsource.TestFixtures.FakeReleaseUploader;
import com.contrastsecurity.appsource.api.HttpStatusException;
import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.config.UploadTarget;
import com.contrastsecurity.appsource.ipa.Sha256ContentHasher;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.service.IdentityResolver;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for selecting GitHub releases
 */
public class ReleaseFeedProviderTest {

    private static final String RELEASES_URL = "https://api.github.com/repos/author/project/releases";

    private FakeDocumentFetcher documents;
    private FakeAssetDownloader downloader;
    private FakePackageInspector inspector;
    private FakeReleaseUploader uploader;
    private ProviderContext context;

    @BeforeEach
    void setUp() {
        documents = new FakeDocumentFetcher().add(RELEASES_URL, TestFixtures.resource("releases/github-releases.json"));
        downloader = new FakeAssetDownloader();
        inspector = new FakePackageInspector(TestFixtures.packageMetadata("com.example.app", "1.2.0", "12"));
        uploader = new FakeReleaseUploader();
        context = TestFixtures.context(documents, downloader, inspector, uploader);
    }

    private static ProviderConfig github() {
        ProviderConfig config = new ProviderConfig("github");
        config.setOwner("author");
        config.setRepo("project");
        return config;
    }

    @Test
    public void testHighestVersionAndNewestMatchingAsset() throws Exception {
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(github(), context);

        assertEquals("1.2.0", provider.getVersion());
        assertEquals("Example-rebuilt.ipa", provider.getAsset().getName());
        assertEquals("2023-05-03T00:00:00Z", provider.getVersionDate());
        assertEquals("# Version 1.2\n\nNew features", provider.getVersionDescription());
        assertEquals(RELEASES_URL, provider.describe());
        assertEquals(Collections.singletonList(RELEASES_URL), documents.getRequested());
    }

    @Test
    public void testPrereleasesIncludedOnRequest() throws Exception {
        ProviderConfig config = github();
        config.setIncludePrereleases(true);
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(config, context);

        assertEquals("1.3.0-beta1", provider.getVersion());
    }

    @Test
    public void testPreferDatePicksLatestAsset() throws Exception {
        ProviderConfig config = github();
        config.setPreferDate(true);
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(config, context);

        assertEquals("nightly", provider.getRelease().getTagName());
        assertEquals("2023-05-20T00:00:00Z", provider.getVersionDate());
    }

    @Test
    public void testAssetPatternMustMatchWholeName() throws Exception {
        ProviderConfig config = github();
        config.setAssetPattern("Example\\.ipa");
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(config, context);
        assertEquals("https://github.com/author/project/releases/download/v1.2.0/Example.ipa",
                provider.getAsset().getBrowserDownloadUrl());

        config.setAssetPattern("Example");
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(config, context));
        assertTrue(e.getMessage().startsWith("No qualifying asset matching"));
    }

    @Test
    public void testFetchAppsCarriesCandidate() throws Exception {
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(github(), context);
        List<App> apps = provider.fetchApps(IdentityResolver.resolve(Collections.singletonList("com.example.app")));

        assertEquals(1, apps.size());
        assertEquals("com.example.app", apps.get(0).getAppID());
        AppVersion version = apps.get(0).latestVersion();
        assertEquals("1.2.0", version.getVersion());
        assertEquals("1.2.0", version.getAbsoluteVersion());
        assertEquals("https://github.com/author/project/releases/download/v1.2.0/Example-rebuilt.ipa",
                version.getDownloadURL());
    }

    @Test
    public void testFetchMetadata() throws Exception {
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(github(), context);
        AssetMetadata metadata = provider.fetchMetadata();

        String url = "https://github.com/author/project/releases/download/v1.2.0/Example-rebuilt.ipa";
        assertEquals(Collections.singletonList(url), downloader.getDownloaded());
        assertEquals(url, metadata.getDownloadURL());
        assertEquals("com.example.app", metadata.getBundleIdentifier());
        assertEquals("12", metadata.getBuildVersion());
        assertEquals(url.length(), metadata.getSize());
        assertEquals(64, metadata.getSha256().length());
        assertEquals("Camera", metadata.getPermissions().getPrivacy().get(0).getName());
        assertFalse(Files.exists(downloader.getFiles().get(0)));
        assertTrue(uploader.getAssetNames().isEmpty());
    }

    @Test
    public void testFetchMetadataUploadsWhenConfigured() throws Exception {
        ProviderConfig config = github();
        config.setUpload(new UploadTarget("me", "ipa-storage"));
        AssetMetadata metadata = ReleaseFeedProvider.open(config, context).fetchMetadata();

        assertEquals(Collections.singletonList("com.example.app-1.2.0.ipa"), uploader.getAssetNames());
        assertEquals("https://github.com/me/ipa-storage/releases/download/v0.0/com.example.app-1.2.0.ipa",
                metadata.getDownloadURL());
    }

    @Test
    public void testUploadWithoutUploader() throws Exception {
        ProviderConfig config = github();
        config.setUpload(new UploadTarget("me", "ipa-storage"));
        ProviderContext noUploader = new ProviderContext(documents, downloader, inspector, new Sha256ContentHasher(), null);

        ReleaseFeedProvider provider = ReleaseFeedProvider.open(config, noUploader);
        assertThrows(ProviderException.class, provider::fetchMetadata);
    }

    @Test
    public void testBrokenPackageBecomesProviderException() throws Exception {
        inspector.setMetadata(null);
        ReleaseFeedProvider provider = ReleaseFeedProvider.open(github(), context);

        ProviderException e = assertThrows(ProviderException.class, provider::fetchMetadata);
        assertTrue(e.getMessage().contains("Payload"));
        assertFalse(Files.exists(downloader.getFiles().get(0)));
    }

    @Test
    public void testRepositoryNotFound() {
        documents.fail(RELEASES_URL, new HttpStatusException(404, RELEASES_URL, "Not Found"));
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(github(), context));
        assertEquals("GitHub repository not found", e.getMessage());
    }

    @Test
    public void testRateLimit() {
        documents.add(RELEASES_URL, JsonParser.parseString(
                "{\"message\": \"API rate limit exceeded for 192.0.2.1.\", \"documentation_url\": \"https://docs.github.com\"}"));
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(github(), context));
        assertEquals("GitHub API rate limit has been exceeded for this hour", e.getMessage());
    }

    @Test
    public void testOtherApiMessage() {
        documents.add(RELEASES_URL, JsonParser.parseString("{\"message\": \"Bad credentials\"}"));
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(github(), context));
        assertEquals("GitHub API issue: Bad credentials", e.getMessage());
    }

    @Test
    public void testNullApiMessage() {
        documents.add(RELEASES_URL, JsonParser.parseString("{\"message\": null}"));
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(github(), context));
        assertEquals("GitHub API issue", e.getMessage());
    }

    @Test
    public void testOnlyPrereleases() {
        documents.add(RELEASES_URL, JsonParser.parseString(
                "[{\"tag_name\": \"v2.0b1\", \"prerelease\": true, \"assets\": []}]"));
        ProviderException e = assertThrows(ProviderException.class, () -> ReleaseFeedProvider.open(github(), context));
        assertEquals("No matching releases found", e.getMessage());
    }

    @Test
    public void testRepositoryRequired() {
        ProviderConfig config = new ProviderConfig("github");
        config.setOwner("author");
        assertThrows(ConfigurationException.class, () -> ReleaseFeedProvider.open(config, context));
    }

    @Test
    public void testExplicitUrlAndTagRewrite() throws Exception {
        String url = "https://example.com/releases.json";
        documents.add(url, JsonParser.parseString("[" +
                "{\"tag_name\": \"release-2.0\", \"assets\": [{\"name\": \"a.ipa\", \"updated_at\": \"2023-01-01T00:00:00Z\", \"browser_download_url\": \"https://example.com/a.ipa\"}]}," +
                "{\"tag_name\": \"release-10.0\", \"assets\": [{\"name\": \"b.ipa\", \"updated_at\": \"2022-01-01T00:00:00Z\", \"browser_download_url\": \"https://example.com/b.ipa\"}]}" +
                "]"));
        ProviderConfig config = new ProviderConfig("github");
        config.setUrl(url);
        config.setTagRewrite(new com.contrastsecurity.appsource.config.TagRewrite("^release-", ""));

        ReleaseFeedProvider provider = ReleaseFeedProvider.open(config, context);
        assertEquals("10.0", provider.getVersion());
        assertEquals("b.ipa", provider.getAsset().getName());
    }
}
