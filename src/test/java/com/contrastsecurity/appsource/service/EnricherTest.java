package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.TestFixtures;
import com.contrastsecurity.appsource.TestFixtures.FakeAssetDownloader;
import com.contrastsecurity.appsource.TestFixtures.FakePackageInspector;
import com.contrastsecurity.appsource.ipa.Sha256ContentHasher;
import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Permissions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

import static com.contrastsecurity.appsource.TestFixtures.app;
import static com.contrastsecurity.appsource.TestFixtures.version;
import static org.junit.jupiter.api.Assertions.*;

public class EnricherTest {

    private FakeAssetDownloader downloader;
    private FakePackageInspector inspector;
    private Enricher enricher;

    @BeforeEach
    void setUp() {
        downloader = new FakeAssetDownloader();
        inspector = new FakePackageInspector(TestFixtures.packageMetadata("com.example.app", "1.0", "1"));
        enricher = new Enricher(downloader, inspector, new Sha256ContentHasher());
    }

    @Test
    public void testFillsMissingHashAndPermissions() throws Exception {
        App app = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        AppVersion version = app.latestVersion();

        assertTrue(enricher.enrich(app, version, false));

        assertEquals(64, version.getSha256().length());
        assertEquals(100L, version.getSize());
        assertEquals("Camera", app.getAppPermissions().getPrivacy().get(0).getName());
        assertFalse(Files.exists(downloader.getFiles().get(0)));
    }

    @Test
    public void testNothingToDo() throws Exception {
        App app = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        app.setAppPermissions(new Permissions());
        app.latestVersion().setSha256("abc");

        assertFalse(enricher.enrich(app, app.latestVersion(), false));
        assertTrue(downloader.getDownloaded().isEmpty());

        assertTrue(enricher.enrich(app, app.latestVersion(), true));
        assertNotEquals("abc", app.latestVersion().getSha256());
    }

    @Test
    public void testSizeFilledWhenMissing() throws Exception {
        AppVersion version = new AppVersion("1.0", "2023-01-01T00:00:00Z", "https://example.com/a.ipa", null);
        App app = app("com.example.app", version);

        enricher.enrichHash(app, version, false);

        assertEquals(Long.valueOf("https://example.com/a.ipa".length()), version.getSize());
        assertNull(app.getAppPermissions());
        assertEquals(0, inspector.getCalls());
    }

    @Test
    public void testFailures() {
        App app = app("com.example.app", new AppVersion("1.0", "2023-01-01T00:00:00Z", null, 1L));
        assertThrows(EnrichmentException.class, () -> enricher.enrich(app, app.latestVersion(), false));

        downloader.setFailing(true);
        App other = app("com.example.other", version("1.0", "2023-01-01T00:00:00Z"));
        Diagnostics diagnostics = new Diagnostics(LoggerFactory.getLogger(EnricherTest.class));
        assertFalse(enricher.tryEnrich(other, other.latestVersion(), false, diagnostics));
        assertNull(other.latestVersion().getSha256());
        assertTrue(diagnostics.getEvents().get(0).getMessage().startsWith("Unable to enrich com.example.other 1.0"));
    }

    @Test
    public void testBrokenPackageKeepsHash() throws Exception {
        inspector.setMetadata(null);
        App app = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        assertThrows(EnrichmentException.class, () -> enricher.enrich(app, app.latestVersion(), false));
        // the hash was computed before inspection failed
        assertNotNull(app.latestVersion().getSha256());
    }
}
