package com.contrastsecurity.appsource.version;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class TagNormalizerTest {

    @Test
    public void testDefaultStripsLeadingV() {
        assertEquals("1.2.0", TagNormalizer.DEFAULT.apply("v1.2.0"));
        assertEquals("1.2.0", TagNormalizer.DEFAULT.apply("1.2.0"));
    }

    @Test
    public void testStripRemovesEveryLeadingOccurrence() {
        assertEquals("1.0", TagNormalizer.DEFAULT.apply("vv1.0"));
        assertEquals("1.0", TagNormalizer.stripLeading("v-").apply("v-1.0"));
        assertEquals("1.0v", TagNormalizer.DEFAULT.apply("v1.0v"));
    }

    @Test
    public void testRewriteRunsBeforeStrip() {
        TagNormalizer normalizer = TagNormalizer.of("v", "^release-", "");
        assertEquals("2.3.4", normalizer.apply("release-v2.3.4"));
    }

    @Test
    public void testRewriteWithGroups() {
        TagNormalizer normalizer = TagNormalizer.of("", "^(\\d+)_(\\d+)$", "$1.$2");
        assertEquals("4.2", normalizer.apply("4_2"));
    }

    @Test
    public void testNullTag() {
        assertNull(TagNormalizer.DEFAULT.apply(null));
    }
}
