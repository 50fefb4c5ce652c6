package com.contrastsecurity.appsource.ipa;

import com.contrastsecurity.appsource.model.Entitlement;
import com.contrastsecurity.appsource.model.Permissions;
import com.contrastsecurity.appsource.model.PrivacyPermission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Inspects iOS app archives (.ipa).
 *
 * The app's {@code Info.plist} sits at {@code Payload/<Name>.app/Info.plist}. Privacy
 * permissions come from its {@code NS...UsageDescription} keys; entitlements live in the
 * signed binary and are not read, so the entitlement list is always empty.
 */
public class IpaInspector implements PackageInspector {
    private static final Logger logger = LoggerFactory.getLogger(IpaInspector.class);

    private static final Pattern INFO_PLIST = Pattern.compile("Payload/[^/]+\\.app/Info\\.plist");
    private static final Pattern NESTED_PACKAGE = Pattern.compile(".*\\.ipa");
    private static final String USAGE_SUFFIX = "UsageDescription";

    @Override
    public PackageMetadata inspect(Path packageFile, boolean extractTwice) throws PackageInspectionException, IOException {
        Path inspected = packageFile;
        boolean temporary = false;
        if (extractTwice) {
            inspected = extractNestedPackage(packageFile);
            temporary = true;
        }
        try {
            Map<String, Object> plist = readInfoPlist(inspected);
            PackageMetadata metadata = fromInfoPlist(plist);
            metadata.setPackageFile(inspected);
            metadata.setTemporaryFile(temporary);
            metadata.setSize(Files.size(inspected));
            logger.debug("Inspected {}: {}", packageFile.getFileName(), metadata);
            return metadata;
        } catch (PackageInspectionException | IOException | RuntimeException e) {
            if (temporary) {
                Files.deleteIfExists(inspected);
            }
            throw e;
        }
    }

    /**
     * Build metadata from the keys of an app's Info.plist.
     */
    public static PackageMetadata fromInfoPlist(Map<String, Object> plist) {
        PackageMetadata metadata = new PackageMetadata();
        metadata.setBundleIdentifier(stringValue(plist, "CFBundleIdentifier"));
        String shortVersion = stringValue(plist, "CFBundleShortVersionString");
        metadata.setVersion(shortVersion != null ? stripLeadingV(shortVersion) : null);
        metadata.setBuildVersion(stringValue(plist, "CFBundleVersion"));
        metadata.setMinOSVersion(stringValue(plist, "MinimumOSVersion"));
        metadata.setPermissions(extractPermissions(plist));
        return metadata;
    }

    /**
     * {@code NSCameraUsageDescription} becomes the privacy permission {@code Camera}.
     */
    public static Permissions extractPermissions(Map<String, Object> plist) {
        List<PrivacyPermission> privacy = new ArrayList<>();
        for (Map.Entry<String, Object> entry : plist.entrySet()) {
            String key = entry.getKey();
            int suffix = key.indexOf(USAGE_SUFFIX);
            if (!key.endsWith(USAGE_SUFFIX) || suffix < 2) {
                continue;
            }
            String description = entry.getValue() != null ? entry.getValue().toString() : null;
            privacy.add(new PrivacyPermission(key.substring(2, suffix), description));
        }
        return new Permissions(new ArrayList<Entitlement>(), privacy);
    }

    private static String stripLeadingV(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == 'v') {
            start++;
        }
        return value.substring(start);
    }

    private static String stringValue(Map<String, Object> plist, String key) {
        Object value = plist.get(key);
        return value != null ? value.toString() : null;
    }

    private static Map<String, Object> readInfoPlist(Path packageFile) throws PackageInspectionException, IOException {
        try (ZipFile zip = new ZipFile(packageFile.toFile())) {
            ZipEntry infoPlist = null;
            boolean hasPayload = false;
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.getName().startsWith("Payload/")) {
                    hasPayload = true;
                }
                if (INFO_PLIST.matcher(entry.getName()).matches()) {
                    infoPlist = entry;
                    break;
                }
            }
            if (!hasPayload) {
                throw new PackageInspectionException("Invalid IPA file does not have a Payload folder inside: " + packageFile);
            }
            if (infoPlist == null) {
                throw new PackageInspectionException("No Info.plist found in the app bundle of " + packageFile);
            }
            try (InputStream in = zip.getInputStream(infoPlist)) {
                return PlistParser.parseDictionary(in.readAllBytes());
            }
        } catch (ZipException e) {
            throw new PackageInspectionException("Not a zip archive: " + packageFile, e);
        }
    }

    private static Path extractNestedPackage(Path archive) throws PackageInspectionException, IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            List<ZipEntry> packages = new ArrayList<>();
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory() && NESTED_PACKAGE.matcher(entry.getName()).matches()) {
                    packages.add(entry);
                }
            }
            if (packages.isEmpty()) {
                throw new PackageInspectionException("No IPA files found in the zip file " + archive);
            }
            if (packages.size() > 1) {
                throw new PackageInspectionException("More files than just an IPA in the zip file " + archive);
            }
            Path extracted = Files.createTempFile("appsource-", ".ipa");
            try (InputStream in = zip.getInputStream(packages.get(0))) {
                Files.copy(in, extracted, StandardCopyOption.REPLACE_EXISTING);
            }
            return extracted;
        } catch (ZipException e) {
            throw new PackageInspectionException("Not a zip archive: " + archive, e);
        }
    }
}
