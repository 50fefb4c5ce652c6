package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.TestFixtures;
import com.contrastsecurity.appsource.TestFixtures.FakeAssetDownloader;
import com.contrastsecurity.appsource.TestFixtures.FakeDocumentFetcher;
import com.contrastsecurity.appsource.TestFixtures.FakePackageInspector;
import com.contrastsecurity.appsource.TestFixtures.FakeReleaseUploader;
import com.contrastsecurity.appsource.config.ConfigurationException;
import com.contrastsecurity.appsource.config.ProviderConfig;
import com.contrastsecurity.appsource.config.TagRewrite;
import com.contrastsecurity.appsource.ipa.Sha256ContentHasher;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.provider.AppProvider;
import com.contrastsecurity.appsource.provider.ProviderContext;
import com.contrastsecurity.appsource.provider.ProviderException;
import com.contrastsecurity.appsource.provider.ProviderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.contrastsecurity.appsource.TestFixtures.app;
import static com.contrastsecurity.appsource.TestFixtures.version;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for merging providers into a catalog
 */
public class CatalogUpdaterTest {

    private static final String MIRROR = "https://example.org/apps.json";
    private static final String RELEASES_URL = "https://api.github.com/repos/author/project/releases";

    private FakeDocumentFetcher documents;
    private FakeAssetDownloader downloader;
    private FakePackageInspector inspector;
    private ProviderContext context;
    private Catalog catalog;

    @BeforeEach
    void setUp() {
        documents = new FakeDocumentFetcher()
                .add(MIRROR, TestFixtures.resource("catalogs/mirror.json"))
                .add(RELEASES_URL, TestFixtures.resource("releases/github-releases.json"));
        downloader = new FakeAssetDownloader();
        inspector = new FakePackageInspector(TestFixtures.packageMetadata("com.example.app", "1.2.0", "12"));
        context = TestFixtures.context(documents, downloader, inspector, new FakeReleaseUploader());
        catalog = Catalog.create("My Apps", "com.example.source");
    }

    private CatalogUpdater updater() {
        return new CatalogUpdater(new ProviderFactory(context), null);
    }

    private CatalogUpdater enrichingUpdater() {
        return new CatalogUpdater(new ProviderFactory(context),
                new Enricher(downloader, inspector, new Sha256ContentHasher()));
    }

    private static ProviderConfig github(Object... ids) {
        ProviderConfig config = new ProviderConfig("github");
        config.setOwner("author");
        config.setRepo("project");
        config.setIds(new ArrayList<>(Arrays.asList(ids)));
        return config;
    }

    private static ProviderConfig mirror(Object... ids) {
        ProviderConfig config = new ProviderConfig("catalog");
        config.setSource(MIRROR);
        config.setIds(new ArrayList<>(Arrays.asList(ids)));
        return config;
    }

    private static List<String> versionStrings(App app) {
        return app.getVersions().stream().map(AppVersion::getVersion).collect(Collectors.toList());
    }

    @Test
    public void testReleaseUpdatePrependsVersion() throws Exception {
        catalog.getApps().add(app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z")));

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(github("com.example.app")));

        assertEquals(1, summary.getAppsUpdated());
        assertEquals(0, summary.getAppsAdded());
        assertTrue(summary.getFailedSources().isEmpty());

        App app = catalog.getApps().get(0);
        assertEquals(Arrays.asList("1.2.0", "1.0.0"), versionStrings(app));
        assertEquals("1.2.0", app.getLegacyVersion());
        assertEquals("com.example.app", app.getAppID());

        AppVersion latest = app.latestVersion();
        assertEquals("1.2.0", latest.getAbsoluteVersion());
        assertEquals("12", latest.getBuildVersion());
        assertEquals("2023-05-03T00:00:00Z", latest.getDate());
        assertEquals("https://github.com/author/project/releases/download/v1.2.0/Example-rebuilt.ipa", latest.getDownloadURL());
        assertEquals("# Version 1.2\n\nNew features", latest.getLocalizedDescription());
        assertNotNull(latest.getSha256());
        assertEquals("Camera", app.getAppPermissions().getPrivacy().get(0).getName());
    }

    @Test
    public void testReleaseAlreadyCurrent() throws Exception {
        catalog.getApps().add(app("com.example.app", version("1.2.0", "2023-05-03T00:00:00Z")));

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(github("com.example.app")));

        assertEquals(0, summary.getAppsUpdated());
        assertTrue(downloader.getDownloaded().isEmpty());
        assertEquals(1, catalog.getApps().get(0).getVersions().size());
    }

    @Test
    public void testBundleIdentifierChange() throws Exception {
        inspector.setMetadata(TestFixtures.packageMetadata("com.example.renamed", "1.2.0", "12"));
        catalog.getApps().add(app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z")));

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(github("com.example.app")));

        App app = catalog.getApps().get(0);
        assertEquals("com.example.renamed", app.getBundleIdentifier());
        assertEquals("com.example.app", app.getAppID());
        assertTrue(app.latestVersion().getLocalizedDescription().endsWith(CatalogUpdater.BUNDLE_ID_CHANGED_NOTE));
        assertTrue(summary.getDiagnostics().hasWarnings());
    }

    @Test
    public void testReleaseForUnknownAppIsSkipped() throws Exception {
        UpdateSummary summary = updater().run(catalog, Collections.singletonList(github("com.example.missing")));

        assertEquals(0, summary.getAppsUpdated());
        assertTrue(summary.getFailedSources().isEmpty());
        assertTrue(documents.getRequested().isEmpty());
        assertEquals(1, summary.getDiagnostics().atLevel(Diagnostic.Level.WARN).size());
    }

    @Test
    public void testUnsupportedKindAbortsRun() {
        ProviderConfig unknown = new ProviderConfig("gitlab");
        assertThrows(ConfigurationException.class,
                () -> updater().run(catalog, Arrays.asList(mirror("org.example.one"), unknown)));
        assertTrue(catalog.getApps().isEmpty());
        assertTrue(catalog.getNews().isEmpty());
    }

    @Test
    public void testInvalidAssetPatternFailsOnlyThatEntry() throws Exception {
        catalog.getApps().add(app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z")));
        ProviderConfig broken = github("com.example.app");
        broken.setAssetPattern("[unclosed");
        ProviderConfig all = mirror();
        all.setGetAllApps(true);

        UpdateSummary summary = updater().run(catalog, Arrays.asList(broken, all));

        assertEquals(Collections.singletonList("github author/project"), summary.getFailedSources());
        assertEquals("1.0.0", catalog.findApp("com.example.app").latestVersion().getVersion());
        assertNotNull(catalog.findApp("org.example.one"));
        assertTrue(summary.getDiagnostics().atLevel(Diagnostic.Level.ERROR).stream()
                .anyMatch(d -> d.getMessage().startsWith("ConfigurationException: Invalid assetPattern")));
    }

    @Test
    public void testInvalidTagRewriteFailsOnlyThatEntry() throws Exception {
        catalog.getApps().add(app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z")));
        ProviderConfig broken = github("com.example.app");
        broken.setTagRewrite(new TagRewrite("(release-", ""));

        UpdateSummary summary = updater().run(catalog, Arrays.asList(broken, github("com.example.app")));

        assertEquals(1, summary.getFailedSources().size());
        assertEquals(1, summary.getAppsUpdated());
        assertEquals("1.2.0", catalog.findApp("com.example.app").latestVersion().getVersion());
    }

    @Test
    public void testUnexpectedFailureIsRolledBackAndRunContinues() throws Exception {
        ProviderFactory factory = new ProviderFactory(context) {
            private int calls;

            @Override
            public AppProvider create(ProviderConfig config) throws ConfigurationException, ProviderException {
                AppProvider provider = super.create(config);
                if (calls++ == 0) {
                    throw new IllegalStateException("provider exploded");
                }
                return provider;
            }
        };
        ProviderConfig all = mirror();
        all.setGetAllApps(true);

        UpdateSummary summary = new CatalogUpdater(factory, null).run(catalog, Arrays.asList(all, all));

        assertEquals(1, summary.getFailedSources().size());
        assertNotNull(catalog.findApp("org.example.one"));
        assertTrue(summary.getDiagnostics().atLevel(Diagnostic.Level.ERROR).stream()
                .anyMatch(d -> d.getMessage().equals("IllegalStateException: provider exploded")));
    }

    @Test
    public void testMissingMirrorIdsAreReported() throws Exception {
        UpdateSummary summary = updater().run(catalog,
                Collections.singletonList(mirror("org.example.one", "org.example.absent")));

        assertEquals(1, summary.getAppsAdded());
        List<Diagnostic> warnings = summary.getDiagnostics().atLevel(Diagnostic.Level.WARN);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getMessage().contains("[org.example.absent]"));
    }

    @Test
    public void testWrongIdCountFailsOnlyThatEntry() throws Exception {
        catalog.getApps().add(app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z")));
        ProviderConfig twoIds = github("com.example.app", "com.example.other");

        UpdateSummary summary = updater().run(catalog, Arrays.asList(twoIds, github("com.example.app")));

        assertEquals(Collections.singletonList("github author/project"), summary.getFailedSources());
        assertEquals(1, summary.getAppsUpdated());
        assertEquals("1.2.0", catalog.getApps().get(0).latestVersion().getVersion());
        assertTrue(summary.toString().endsWith("1 source(s) failed"));
    }

    @Test
    public void testFailedEntryIsRolledBack() throws Exception {
        catalog.getApps().add(app("a.b.c", version("not-a-version", "2023-01-01T00:00:00Z")));
        ProviderConfig all = mirror();
        all.setGetAllApps(true);

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(all));

        assertEquals(1, summary.getFailedSources().size());
        assertEquals(0, summary.getAppsAdded());
        assertEquals(Collections.singletonList("a.b.c"), catalog.getAppIds());
        assertTrue(catalog.getNews().isEmpty());
        assertTrue(summary.getDiagnostics().atLevel(Diagnostic.Level.ERROR).stream()
                .anyMatch(d -> d.getMessage().startsWith("VersionParseException")));
    }

    @Test
    public void testMirrorAddsAppsAndNews() throws Exception {
        ProviderConfig config = mirror("org.example.one", Collections.singletonMap("x.y.z", "a.b.c"));
        config.setGetAllNews(true);

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(config));

        assertEquals(2, summary.getAppsAdded());
        assertEquals(2, summary.getNewsAdded());
        assertEquals(Arrays.asList("org.example.one", "x.y.z"), catalog.getAppIds());

        summary = updater().run(catalog, Collections.singletonList(config));
        assertEquals(0, summary.getAppsAdded());
        assertEquals(0, summary.getAppsUpdated());
        assertEquals(0, summary.getNewsAdded());
        assertEquals(2, catalog.getNews().size());
    }

    @Test
    public void testMirrorNewsFollowsIdsByDefault() throws Exception {
        updater().run(catalog, Collections.singletonList(mirror("org.example.one")));
        assertEquals(1, catalog.getNews().size());
        assertEquals("one-2.0", catalog.getNews().get(0).getIdentifier());

        Catalog other = Catalog.create("Other", "com.example.other");
        ProviderConfig quiet = mirror("org.example.one");
        quiet.setIgnoreNews(true);
        updater().run(other, Collections.singletonList(quiet));
        assertTrue(other.getNews().isEmpty());
    }

    @Test
    public void testReplaceMergeTakesUpstreamApp() throws Exception {
        App local = app("org.example.one", version("1.0.0", "2023-01-01T00:00:00Z"));
        local.setAppID("org.example.one");
        local.setName("Local Name");
        catalog.getApps().add(local);

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(mirror("org.example.one")));

        assertEquals(1, summary.getAppsUpdated());
        App merged = catalog.getApps().get(0);
        assertEquals("Example One", merged.getName());
        assertEquals("org.example.one", merged.getAppID());
        assertEquals(Arrays.asList("2.0.0", "1.0.0"), versionStrings(merged));
        assertEquals("https://example.org/one-1.0.0.ipa", merged.getVersions().get(1).getDownloadURL());
    }

    @Test
    public void testPatchMergeKeepsLocalApp() throws Exception {
        App local = app("org.example.one", version("1.0.0", "2023-01-01T00:00:00Z"));
        local.setName("Local Name");
        catalog.getApps().add(local);
        ProviderConfig config = mirror("org.example.one");
        config.setMergePolicy(ProviderConfig.MERGE_PATCH);

        UpdateSummary summary = enrichingUpdater().run(catalog, Collections.singletonList(config));

        assertEquals(1, summary.getAppsUpdated());
        App merged = catalog.getApps().get(0);
        assertSame(local, merged);
        assertEquals("Local Name", merged.getName());
        assertEquals(Arrays.asList("2.0.0", "1.0.0"), versionStrings(merged));
        assertEquals("https://example.com/1.0.0.ipa", merged.getVersions().get(1).getDownloadURL());

        // the local app had no permissions, so the accepted version's package was inspected
        assertEquals(Collections.singletonList("https://example.org/one-2.0.0.ipa"), downloader.getDownloaded());
        assertEquals("Camera", merged.getAppPermissions().getPrivacy().get(0).getName());
        assertEquals("aa11", merged.latestVersion().getSha256());
    }

    @Test
    public void testOlderMirrorVersionIsIgnored() throws Exception {
        catalog.getApps().add(app("org.example.one", version("3.0.0", "2023-06-01T00:00:00Z")));
        ProviderConfig config = mirror("org.example.one");
        config.setMergePolicy(ProviderConfig.MERGE_PATCH);

        UpdateSummary summary = updater().run(catalog, Collections.singletonList(config));

        assertEquals(0, summary.getAppsUpdated());
        assertEquals(Collections.singletonList("3.0.0"), versionStrings(catalog.getApps().get(0)));
    }

    @Test
    public void testEnrichmentCanBeDisabled() throws Exception {
        ProviderConfig config = mirror(Collections.singletonMap("x.y.z", "a.b.c"));
        config.setEnrich(false);
        enrichingUpdater().run(catalog, Collections.singletonList(config));
        assertTrue(downloader.getDownloaded().isEmpty());

        Catalog other = Catalog.create("Other", "com.example.other");
        enrichingUpdater().run(other, Collections.singletonList(mirror(Collections.singletonMap("x.y.z", "a.b.c"))));
        assertEquals(Collections.singletonList("https://example.org/abc-3.1.ipa"), downloader.getDownloaded());
    }

    @Test
    public void testEnrichmentFailureIsOnlyAWarning() throws Exception {
        downloader.setFailing(true);
        UpdateSummary summary = enrichingUpdater().run(catalog,
                Collections.singletonList(mirror(Collections.singletonMap("x.y.z", "a.b.c"))));

        assertEquals(1, summary.getAppsAdded());
        assertTrue(summary.getFailedSources().isEmpty());
        assertNull(catalog.getApps().get(0).getAppPermissions());
        assertTrue(summary.getDiagnostics().hasWarnings());
    }

    @Test
    public void testEntriesSeeEarlierAdditions() throws Exception {
        documents.add("https://example.net/releases.json", TestFixtures.resource("releases/curated.json"));
        inspector.setMetadata(TestFixtures.packageMetadata("org.example.one", "8.0.2", "802"));
        ProviderConfig release = new ProviderConfig("releases");
        release.setUrl("https://example.net/releases.json");
        release.setBaseUrl("https://example.net");
        release.setIds(new ArrayList<>(Collections.singletonList("org.example.one")));

        UpdateSummary summary = updater().run(catalog, Arrays.asList(mirror("org.example.one"), release));

        assertEquals(1, summary.getAppsAdded());
        assertEquals(1, summary.getAppsUpdated());
        App app = catalog.getApps().get(0);
        assertEquals(Arrays.asList("8.0.2", "2.0.0", "1.0.0"), versionStrings(app));
        assertEquals("https://example.net/downloads/8.0.2/tool.ipa", app.latestVersion().getDownloadURL());
    }

    @Test
    public void testTruncate() {
        assertEquals("a\n\tb", CatalogUpdater.truncate("a\nb"));
        StringBuilder longMessage = new StringBuilder();
        for (int i = 0; i < 400; i++) {
            longMessage.append('x');
        }
        assertEquals(303, CatalogUpdater.truncate(longMessage.toString()).length());
        assertEquals("", CatalogUpdater.truncate(null));
    }
}
