package com.contrastsecurity.appsource.config;

import com.contrastsecurity.appsource.TestFixtures;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading update configuration files
 */
public class ConfigLoaderTest {

    @Test
    public void testParseFullConfiguration() throws Exception {
        UpdateConfig config = ConfigLoader.parse(TestFixtures.readResource("config/update.json"));

        HttpSettings http = config.getHttp();
        assertEquals(10, http.getConnectTimeoutSeconds());
        assertEquals(20, http.getReadTimeoutSeconds());
        assertEquals(60, http.getWriteTimeoutSeconds());
        assertEquals(3, http.getMaxRetries());
        assertEquals(100L, http.getRetryBackoffMillis());
        assertEquals("GITHUB_TOKEN", http.getTokenEnv());

        assertEquals(3, config.getSources().size());
        assertTrue(config.isUpdateHashes());

        ProviderConfig catalog = config.getSources().get(0);
        assertEquals("catalog", catalog.getKind());
        assertEquals("https://example.org/apps.json", catalog.getSource());
        assertTrue(catalog.isGetAllNews());
        assertFalse(catalog.isGetAllApps());
        assertEquals(2, catalog.getIds().size());
        assertEquals("org.example.one", catalog.getIds().get(0));
        assertTrue(catalog.getIds().get(1) instanceof Map);
        assertEquals("a.b.c", ((Map<?, ?>) catalog.getIds().get(1)).get("x.y.z"));
        assertFalse(catalog.isPatchMerge());
        assertTrue(catalog.isEnrich());

        ProviderConfig github = config.getSources().get(1);
        assertTrue(github.isPreferDate());
        assertEquals("Example.*\\.ipa", github.getAssetPattern());
        assertEquals("2.0", github.tagNormalizer().apply("release-v2.0"));
        assertEquals("me/ipa-storage", github.getUpload().toString());
        assertEquals("GitHub author/project", github.describe());

        ProviderConfig releases = config.getSources().get(2);
        assertTrue(releases.isPatchMerge());
        assertEquals("https://example.net", releases.getBaseUrl());
        assertEquals(ProviderConfig.DEFAULT_ASSET_PATTERN, releases.getAssetPattern());

        assertEquals("#ff0000", config.getOverrides().get("com.example.app").get("tintColor").getAsString());
    }

    @Test
    public void testDefaults() throws Exception {
        UpdateConfig config = ConfigLoader.parse("{}");
        assertNotNull(config.getHttp());
        assertEquals(30, config.getHttp().getConnectTimeoutSeconds());
        assertTrue(config.getSources().isEmpty());
        assertTrue(config.getOverrides().isEmpty());
        assertFalse(config.isUpdateHashes());
    }

    @Test
    public void testSourceWithoutKind() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse("{\"sources\": [{\"kind\": \"catalog\"}, {\"source\": \"x.json\"}]}"));
        assertTrue(e.getMessage().contains("#2"));
    }

    @Test
    public void testMalformedConfiguration() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse("{\"sources\": ["));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(""));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(Paths.get("does/not/exist.json")));
    }
}
