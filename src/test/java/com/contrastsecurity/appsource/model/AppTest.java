package com.contrastsecurity.appsource.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.contrastsecurity.appsource.TestFixtures.app;
import static com.contrastsecurity.appsource.TestFixtures.version;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the App class
 */
public class AppTest {

    private static List<String> versionStrings(App app) {
        return app.getVersions().stream().map(AppVersion::getVersion).collect(Collectors.toList());
    }

    @Test
    public void testAddVersionPrependsAndSyncsLegacyFields() {
        App app = app("com.example.app", version("1.0.0", "2023-01-01T00:00:00Z"));
        AppVersion newer = version("1.2.0", "2023-05-01T00:00:00Z");
        newer.setLocalizedDescription("Fixes");

        assertFalse(app.addVersion(newer));

        assertEquals(Arrays.asList("1.2.0", "1.0.0"), versionStrings(app));
        assertEquals("1.2.0", app.getLegacyVersion());
        assertEquals("2023-05-01T00:00:00Z", app.getLegacyVersionDate());
        assertEquals("Fixes", app.getLegacyVersionDescription());
        assertEquals("https://example.com/1.2.0.ipa", app.getLegacyDownloadURL());
        assertEquals(100L, app.getLegacySize());
    }

    @Test
    public void testAddVersionReplacesSameReleaseInPlace() {
        App app = app("com.example.app",
                version("2.0", "2023-02-01T00:00:00Z"),
                version("1.0", "2023-01-01T00:00:00Z"));
        AppVersion rebuilt = version("1.0", "2023-03-01T00:00:00Z");
        rebuilt.setDownloadURL("https://example.com/rebuilt.ipa");

        assertTrue(app.addVersion(rebuilt));

        assertEquals(Arrays.asList("2.0", "1.0"), versionStrings(app));
        assertEquals("https://example.com/rebuilt.ipa", app.getVersions().get(1).getDownloadURL());
        assertEquals("2.0", app.getLegacyVersion());
    }

    @Test
    public void testDifferentBuildIsANewEntry() {
        AppVersion first = version("1.0", "2023-01-01T00:00:00Z");
        first.setBuildVersion("1");
        App app = app("com.example.app", first);
        AppVersion second = version("1.0", "2023-01-02T00:00:00Z");
        second.setBuildVersion("2");

        assertFalse(app.addVersion(second));
        assertEquals(2, app.getVersions().size());
    }

    @Test
    public void testLatestVersionByDate() {
        App app = app("com.example.app",
                version("2.0", "2023-02-01T00:00:00Z"),
                version("1.9", "2023-06-01T00:00:00Z"));
        assertEquals("2.0", app.latestVersion().getVersion());
        assertEquals("1.9", app.latestVersion(true).getVersion());
        assertNull(new App("x", "X").latestVersion());
    }

    @Test
    public void testIdentityKeyPrefersAppId() {
        App app = app("com.example.upstream");
        assertEquals("com.example.upstream", app.getIdentityKey());
        app.setAppID("com.example.mine");
        assertEquals("com.example.mine", app.getIdentityKey());
    }

    @Test
    public void testValidation() {
        App valid = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        assertTrue(valid.isValid());

        App noVersions = app("com.example.app");
        assertFalse(noVersions.isValid());
        assertTrue(noVersions.missingKeys().contains("versions"));

        App badVersion = app("com.example.app", new AppVersion("1.0", null, "https://example.com/a.ipa", 1L));
        assertFalse(badVersion.isValid());

        App missingIcon = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        missingIcon.setIconURL(null);
        assertEquals(Arrays.asList("iconURL"), missingIcon.missingKeys());
    }

    @Test
    public void testCopyIsDeep() {
        App original = app("com.example.app", version("1.0", "2023-01-01T00:00:00Z"));
        App copy = original.copy();
        copy.getVersions().get(0).setSha256("beef");
        copy.addVersion(version("2.0", "2023-02-01T00:00:00Z"));

        assertNull(original.getVersions().get(0).getSha256());
        assertEquals(1, original.getVersions().size());
    }
}
