package com.contrastsecurity.appsource.ipa;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PlistParserTest {

    private static Map<String, Object> parse(String xml) throws PackageInspectionException {
        return PlistParser.parseDictionary(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testValueTypes() throws Exception {
        Map<String, Object> plist = parse("<plist version=\"1.0\"><dict>" +
                "<key>name</key><string>Example</string>" +
                "<key>count</key><integer>42</integer>" +
                "<key>ratio</key><real>1.5</real>" +
                "<key>enabled</key><true/>" +
                "<key>hidden</key><false/>" +
                "<key>list</key><array><string>a</string><string>b</string></array>" +
                "<key>nested</key><dict><key>inner</key><string>value</string></dict>" +
                "</dict></plist>");

        assertEquals("Example", plist.get("name"));
        assertEquals(42L, plist.get("count"));
        assertEquals(1.5, plist.get("ratio"));
        assertEquals(Boolean.TRUE, plist.get("enabled"));
        assertEquals(Boolean.FALSE, plist.get("hidden"));
        assertEquals(Arrays.asList("a", "b"), plist.get("list"));
        assertEquals("value", ((Map<?, ?>) plist.get("nested")).get("inner"));
    }

    @Test
    public void testBinaryPlistRejected() {
        byte[] content = "bplist00Ñ\u0001\u0002".getBytes(StandardCharsets.ISO_8859_1);
        PackageInspectionException e = assertThrows(PackageInspectionException.class,
                () -> PlistParser.parseDictionary(content));
        assertEquals("Binary property lists are not supported", e.getMessage());
    }

    @Test
    public void testMalformedPlists() {
        assertThrows(PackageInspectionException.class, () -> parse("<plist><array/></plist>"));
        assertThrows(PackageInspectionException.class, () -> parse("<plist><dict><key>a</key></dict></plist>"));
        assertThrows(PackageInspectionException.class, () -> parse("<plist><dict><key>a</key><integer>x</integer></dict></plist>"));
        assertThrows(PackageInspectionException.class, () -> parse("not xml"));
    }
}
