package com.contrastsecurity.appsource.util;

import com.contrastsecurity.appsource.model.App;
import com.contrastsecurity.appsource.model.AppVersion;
import com.contrastsecurity.appsource.model.Catalog;
import com.contrastsecurity.appsource.model.Entitlement;
import com.contrastsecurity.appsource.model.NewsArticle;
import com.contrastsecurity.appsource.model.Permissions;
import com.contrastsecurity.appsource.model.PrivacyPermission;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes catalog documents.
 *
 * Known keys are mapped onto the typed model; every other key (and any known key whose
 * value has an unexpected JSON type) is kept in the owning entity's extension map in
 * document order, so a full write reproduces what was read.
 *
 * Output key order is fixed: known keys in schema order, then first-generation keys,
 * then extension keys. Loading a written document and writing it again is byte-identical.
 */
public final class CatalogJson {
    private static final Logger logger = LoggerFactory.getLogger(CatalogJson.class);

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

    private CatalogJson() {
        // Utility class - prevent instantiation
    }

    // ---------------------------------------------------------------- files

    /**
     * Load a catalog document from disk.
     *
     * @throws FileNotFoundException if the file does not exist
     * @throws JsonParseException if the file is not a JSON object
     */
    public static Catalog load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException(path + " not found");
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parseCatalog(JsonParser.parseString(content).getAsJsonObject());
    }

    /**
     * Write a catalog document. The file always ends with exactly one newline.
     *
     * @param pretty two-space indentation when true, no whitespace when false
     * @param full include extension keys the model does not know about
     */
    public static void write(Catalog catalog, Path path, boolean pretty, boolean full) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJsonString(catalog, pretty, full), StandardCharsets.UTF_8);
    }

    public static String toJsonString(Catalog catalog, boolean pretty, boolean full) {
        Gson gson = pretty ? PRETTY : COMPACT;
        return gson.toJson(toJson(catalog, full)) + "\n";
    }

    // ---------------------------------------------------------------- reading

    /**
     * Build a catalog from a parsed document. The schema tag is set to the current
     * generation because every app is upgraded on load.
     */
    public static Catalog parseCatalog(JsonObject json) {
        Catalog catalog = new Catalog();
        boolean appsSeen = false;
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            boolean handled = true;
            switch (key) {
                case "name":
                    catalog.setName(asString(value));
                    handled = catalog.getName() != null;
                    break;
                case "identifier":
                    catalog.setIdentifier(asString(value));
                    handled = catalog.getIdentifier() != null;
                    break;
                case "apiVersion":
                    handled = asString(value) != null;
                    break;
                case "subtitle":
                    catalog.setSubtitle(asString(value));
                    handled = catalog.getSubtitle() != null;
                    break;
                case "description":
                    catalog.setDescription(asString(value));
                    handled = catalog.getDescription() != null;
                    break;
                case "iconURL":
                    catalog.setIconURL(asString(value));
                    handled = catalog.getIconURL() != null;
                    break;
                case "headerURL":
                    catalog.setHeaderURL(asString(value));
                    handled = catalog.getHeaderURL() != null;
                    break;
                case "website":
                    catalog.setWebsite(asString(value));
                    handled = catalog.getWebsite() != null;
                    break;
                case "tintColor":
                    catalog.setTintColor(asString(value));
                    handled = catalog.getTintColor() != null;
                    break;
                case "featuredApps":
                    catalog.setFeaturedApps(asStringList(value));
                    handled = catalog.getFeaturedApps() != null;
                    break;
                case "userinfo":
                    handled = value.isJsonObject();
                    if (handled) {
                        catalog.setUserinfo(value.getAsJsonObject());
                    }
                    break;
                case "apps":
                    handled = value.isJsonArray();
                    if (handled) {
                        appsSeen = true;
                        List<App> apps = new ArrayList<>();
                        for (JsonElement element : value.getAsJsonArray()) {
                            if (element.isJsonObject()) {
                                apps.add(parseApp(element.getAsJsonObject()));
                            } else {
                                logger.warn("Skipping app entry that is not an object: {}", element);
                            }
                        }
                        catalog.setApps(apps);
                    }
                    break;
                case "news":
                    handled = value.isJsonArray();
                    if (handled) {
                        List<NewsArticle> news = new ArrayList<>();
                        for (JsonElement element : value.getAsJsonArray()) {
                            if (element.isJsonObject()) {
                                news.add(parseArticle(element.getAsJsonObject()));
                            } else {
                                logger.warn("Skipping news entry that is not an object: {}", element);
                            }
                        }
                        catalog.setNews(news);
                    }
                    break;
                default:
                    handled = false;
            }
            if (!handled) {
                catalog.getExtensions().put(key, value);
            }
        }
        catalog.setApiVersion(Catalog.CURRENT_API_VERSION);

        List<String> missing = catalog.missingKeys();
        if (!appsSeen) {
            missing.add("apps");
        }
        if (!missing.isEmpty()) {
            logger.warn("Missing required catalog keys: {}", missing);
        }
        return catalog;
    }

    /**
     * Build an app from a parsed document. Documents without a {@code versions} array get
     * one version synthesized from the first-generation top-level fields.
     */
    public static App parseApp(JsonObject json) {
        App app = new App();
        boolean versionsSeen = false;
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            boolean handled = true;
            switch (key) {
                case "appID":
                    app.setAppID(asString(value));
                    handled = app.getAppID() != null;
                    break;
                case "bundleIdentifier":
                    app.setBundleIdentifier(asString(value));
                    handled = app.getBundleIdentifier() != null;
                    break;
                case "name":
                    app.setName(asString(value));
                    handled = app.getName() != null;
                    break;
                case "developerName":
                    app.setDeveloperName(asString(value));
                    handled = app.getDeveloperName() != null;
                    break;
                case "subtitle":
                    app.setSubtitle(asString(value));
                    handled = app.getSubtitle() != null;
                    break;
                case "localizedDescription":
                    app.setLocalizedDescription(asString(value));
                    handled = app.getLocalizedDescription() != null;
                    break;
                case "iconURL":
                    app.setIconURL(asString(value));
                    handled = app.getIconURL() != null;
                    break;
                case "tintColor":
                    app.setTintColor(asString(value));
                    handled = app.getTintColor() != null;
                    break;
                case "beta":
                    app.setBeta(asBoolean(value));
                    handled = app.getBeta() != null;
                    break;
                case "versions":
                    handled = value.isJsonArray();
                    if (handled) {
                        versionsSeen = true;
                        List<AppVersion> versions = new ArrayList<>();
                        for (JsonElement element : value.getAsJsonArray()) {
                            if (element.isJsonObject()) {
                                versions.add(parseVersion(element.getAsJsonObject()));
                            }
                        }
                        app.setVersions(versions);
                    }
                    break;
                case "appPermissions":
                    handled = value.isJsonObject();
                    if (handled) {
                        app.setAppPermissions(parsePermissions(value.getAsJsonObject()));
                    }
                    break;
                case "version":
                    app.setLegacyVersion(asString(value));
                    handled = app.getLegacyVersion() != null;
                    break;
                case "versionDate":
                    app.setLegacyVersionDate(asString(value));
                    handled = app.getLegacyVersionDate() != null;
                    break;
                case "versionDescription":
                    app.setLegacyVersionDescription(asString(value));
                    handled = app.getLegacyVersionDescription() != null;
                    break;
                case "downloadURL":
                    app.setLegacyDownloadURL(asString(value));
                    handled = app.getLegacyDownloadURL() != null;
                    break;
                case "size":
                    app.setLegacySize(asLong(value));
                    handled = app.getLegacySize() != null;
                    break;
                case "permissions":
                    handled = value.isJsonArray();
                    if (handled) {
                        app.setLegacyPermissions(value.getAsJsonArray());
                    }
                    break;
                default:
                    handled = false;
            }
            if (!handled) {
                app.getExtensions().put(key, value);
            }
        }

        if (!versionsSeen && hasAnyLegacyField(app)) {
            AppVersion synthesized = new AppVersion(app.getLegacyVersion(), app.getLegacyVersionDate(),
                    app.getLegacyDownloadURL(), app.getLegacySize());
            synthesized.setLocalizedDescription(app.getLegacyVersionDescription());
            List<AppVersion> versions = new ArrayList<>();
            versions.add(synthesized);
            app.setVersions(versions);
            logger.debug("Converted first-generation version fields of {} into a version entry", app.getIdentityKey());
        }

        List<String> missing = app.missingKeys();
        if (!missing.isEmpty()) {
            logger.warn("Missing required app keys for {}: {}", app.getIdentityKey(), missing);
        }
        if (app.getVersions() != null) {
            for (AppVersion version : app.getVersions()) {
                List<String> missingVersionKeys = version.missingKeys();
                if (!missingVersionKeys.isEmpty()) {
                    logger.warn("Missing required version keys for {} {}: {}",
                            app.getIdentityKey(), version.getVersion(), missingVersionKeys);
                }
            }
        }
        return app;
    }

    private static boolean hasAnyLegacyField(App app) {
        return app.getLegacyVersion() != null || app.getLegacyVersionDate() != null ||
                app.getLegacyDownloadURL() != null || app.getLegacySize() != null ||
                app.getLegacyVersionDescription() != null;
    }

    public static AppVersion parseVersion(JsonObject json) {
        AppVersion version = new AppVersion();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            boolean handled = true;
            switch (key) {
                case "version":
                    version.setVersion(asString(value));
                    handled = version.getVersion() != null;
                    break;
                case "absoluteVersion":
                    version.setAbsoluteVersion(asString(value));
                    handled = version.getAbsoluteVersion() != null;
                    break;
                case "buildVersion":
                    version.setBuildVersion(asString(value));
                    handled = version.getBuildVersion() != null;
                    break;
                case "date":
                    version.setDate(asString(value));
                    handled = version.getDate() != null;
                    break;
                case "localizedDescription":
                    version.setLocalizedDescription(asString(value));
                    handled = version.getLocalizedDescription() != null;
                    break;
                case "downloadURL":
                    version.setDownloadURL(asString(value));
                    handled = version.getDownloadURL() != null;
                    break;
                case "size":
                    version.setSize(asLong(value));
                    handled = version.getSize() != null;
                    break;
                case "sha256":
                    version.setSha256(asString(value));
                    handled = version.getSha256() != null;
                    break;
                case "minOSVersion":
                    version.setMinOSVersion(asString(value));
                    handled = version.getMinOSVersion() != null;
                    break;
                case "maxOSVersion":
                    version.setMaxOSVersion(asString(value));
                    handled = version.getMaxOSVersion() != null;
                    break;
                default:
                    handled = false;
            }
            if (!handled) {
                version.getExtensions().put(key, value);
            }
        }
        return version;
    }

    public static Permissions parsePermissions(JsonObject json) {
        Permissions permissions = new Permissions(null, null);
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            if ("entitlements".equals(key) && value.isJsonArray()) {
                List<Entitlement> entitlements = new ArrayList<>();
                for (JsonElement element : value.getAsJsonArray()) {
                    entitlements.add(parseEntitlement(element));
                }
                permissions.setEntitlements(entitlements);
            } else if ("privacy".equals(key) && value.isJsonArray()) {
                List<PrivacyPermission> privacy = new ArrayList<>();
                for (JsonElement element : value.getAsJsonArray()) {
                    if (element.isJsonObject()) {
                        privacy.add(parsePrivacy(element.getAsJsonObject()));
                    }
                }
                permissions.setPrivacy(privacy);
            } else {
                permissions.getExtensions().put(key, value);
            }
        }
        for (PrivacyPermission unknown : permissions.unknownPrivacyCategories()) {
            logger.warn("Privacy permission name not found in known categories: {}", unknown.getName());
        }
        return permissions;
    }

    /**
     * Entitlements are objects with a {@code name}; a bare string is read as the name.
     */
    private static Entitlement parseEntitlement(JsonElement element) {
        Entitlement entitlement = new Entitlement();
        if (element.isJsonPrimitive()) {
            entitlement.setName(element.getAsString());
            return entitlement;
        }
        if (element.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                String name = "name".equals(entry.getKey()) ? asString(entry.getValue()) : null;
                if (name != null) {
                    entitlement.setName(name);
                } else if (!entry.getValue().isJsonNull()) {
                    entitlement.getExtensions().put(entry.getKey(), entry.getValue());
                }
            }
        }
        if (!entitlement.isValid()) {
            logger.warn("Missing required entitlement keys: [name]");
        }
        return entitlement;
    }

    private static PrivacyPermission parsePrivacy(JsonObject json) {
        PrivacyPermission permission = new PrivacyPermission();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value.isJsonNull()) {
                continue;
            }
            String text = asString(value);
            if ("name".equals(key) && text != null) {
                permission.setName(text);
            } else if ("usageDescription".equals(key) && text != null) {
                permission.setUsageDescription(text);
            } else {
                permission.getExtensions().put(key, value);
            }
        }
        List<String> missing = permission.missingKeys();
        if (!missing.isEmpty()) {
            logger.warn("Missing required privacy permission keys: {}", missing);
        }
        return permission;
    }

    public static NewsArticle parseArticle(JsonObject json) {
        NewsArticle article = new NewsArticle();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (value == null || value.isJsonNull()) {
                continue;
            }
            boolean handled = true;
            switch (key) {
                case "identifier":
                    article.setIdentifier(asString(value));
                    handled = article.getIdentifier() != null;
                    break;
                case "title":
                    article.setTitle(asString(value));
                    handled = article.getTitle() != null;
                    break;
                case "caption":
                    article.setCaption(asString(value));
                    handled = article.getCaption() != null;
                    break;
                case "date":
                    article.setDate(asString(value));
                    handled = article.getDate() != null;
                    break;
                case "imageURL":
                    article.setImageURL(asString(value));
                    handled = article.getImageURL() != null;
                    break;
                case "tintColor":
                    article.setTintColor(asString(value));
                    handled = article.getTintColor() != null;
                    break;
                case "notify":
                    article.setNotify(asBoolean(value));
                    handled = article.getNotify() != null;
                    break;
                case "url":
                    article.setUrl(asString(value));
                    handled = article.getUrl() != null;
                    break;
                case "appID":
                    article.setAppID(asString(value));
                    handled = article.getAppID() != null;
                    break;
                default:
                    handled = false;
            }
            if (!handled) {
                article.getExtensions().put(key, value);
            }
        }
        List<String> missing = article.missingKeys();
        if (!missing.isEmpty()) {
            logger.warn("Missing required news article keys: {}", missing);
        }
        return article;
    }

    // ---------------------------------------------------------------- writing

    public static JsonObject toJson(Catalog catalog, boolean full) {
        JsonObject json = new JsonObject();
        put(json, "name", catalog.getName());
        put(json, "identifier", catalog.getIdentifier());
        put(json, "apiVersion", catalog.getApiVersion());
        put(json, "subtitle", catalog.getSubtitle());
        put(json, "description", catalog.getDescription());
        put(json, "iconURL", catalog.getIconURL());
        put(json, "headerURL", catalog.getHeaderURL());
        put(json, "website", catalog.getWebsite());
        put(json, "tintColor", catalog.getTintColor());
        if (catalog.getFeaturedApps() != null) {
            JsonArray featured = new JsonArray();
            catalog.getFeaturedApps().forEach(featured::add);
            json.add("featuredApps", featured);
        }
        JsonArray apps = new JsonArray();
        for (App app : catalog.getApps()) {
            apps.add(toJson(app, full));
        }
        json.add("apps", apps);
        if (catalog.getNews() != null) {
            JsonArray news = new JsonArray();
            for (NewsArticle article : catalog.getNews()) {
                news.add(toJson(article, full));
            }
            json.add("news", news);
        }
        if (catalog.getUserinfo() != null) {
            json.add("userinfo", catalog.getUserinfo());
        }
        putExtensions(json, catalog.getExtensions(), full);
        return json;
    }

    public static JsonObject toJson(App app, boolean full) {
        JsonObject json = new JsonObject();
        put(json, "name", app.getName());
        put(json, "bundleIdentifier", app.getBundleIdentifier());
        put(json, "appID", app.getAppID());
        put(json, "developerName", app.getDeveloperName());
        put(json, "subtitle", app.getSubtitle());
        put(json, "localizedDescription", app.getLocalizedDescription());
        put(json, "iconURL", app.getIconURL());
        put(json, "tintColor", app.getTintColor());
        if (app.getBeta() != null) {
            json.addProperty("beta", app.getBeta());
        }
        if (app.getVersions() != null) {
            JsonArray versions = new JsonArray();
            for (AppVersion version : app.getVersions()) {
                versions.add(toJson(version, full));
            }
            json.add("versions", versions);
        }
        if (app.getAppPermissions() != null) {
            json.add("appPermissions", toJson(app.getAppPermissions(), full));
        }
        put(json, "version", app.getLegacyVersion());
        put(json, "versionDate", app.getLegacyVersionDate());
        put(json, "versionDescription", app.getLegacyVersionDescription());
        put(json, "downloadURL", app.getLegacyDownloadURL());
        if (app.getLegacySize() != null) {
            json.addProperty("size", app.getLegacySize());
        }
        if (app.getLegacyPermissions() != null) {
            json.add("permissions", app.getLegacyPermissions());
        }
        putExtensions(json, app.getExtensions(), full);
        return json;
    }

    public static JsonObject toJson(AppVersion version, boolean full) {
        JsonObject json = new JsonObject();
        put(json, "version", version.getVersion());
        put(json, "absoluteVersion", version.getAbsoluteVersion());
        put(json, "buildVersion", version.getBuildVersion());
        put(json, "date", version.getDate());
        put(json, "localizedDescription", version.getLocalizedDescription());
        put(json, "downloadURL", version.getDownloadURL());
        if (version.getSize() != null) {
            json.addProperty("size", version.getSize());
        }
        put(json, "sha256", version.getSha256());
        put(json, "minOSVersion", version.getMinOSVersion());
        put(json, "maxOSVersion", version.getMaxOSVersion());
        putExtensions(json, version.getExtensions(), full);
        return json;
    }

    public static JsonObject toJson(Permissions permissions, boolean full) {
        JsonObject json = new JsonObject();
        if (permissions.getEntitlements() != null) {
            JsonArray entitlements = new JsonArray();
            for (Entitlement entitlement : permissions.getEntitlements()) {
                JsonObject item = new JsonObject();
                put(item, "name", entitlement.getName());
                putExtensions(item, entitlement.getExtensions(), full);
                entitlements.add(item);
            }
            json.add("entitlements", entitlements);
        }
        if (permissions.getPrivacy() != null) {
            JsonArray privacy = new JsonArray();
            for (PrivacyPermission permission : permissions.getPrivacy()) {
                JsonObject item = new JsonObject();
                put(item, "name", permission.getName());
                put(item, "usageDescription", permission.getUsageDescription());
                putExtensions(item, permission.getExtensions(), full);
                privacy.add(item);
            }
            json.add("privacy", privacy);
        }
        putExtensions(json, permissions.getExtensions(), full);
        return json;
    }

    public static JsonObject toJson(NewsArticle article, boolean full) {
        JsonObject json = new JsonObject();
        put(json, "title", article.getTitle());
        put(json, "identifier", article.getIdentifier());
        put(json, "caption", article.getCaption());
        put(json, "date", article.getDate());
        put(json, "tintColor", article.getTintColor());
        put(json, "imageURL", article.getImageURL());
        if (article.getNotify() != null) {
            json.addProperty("notify", article.getNotify());
        }
        put(json, "url", article.getUrl());
        put(json, "appID", article.getAppID());
        putExtensions(json, article.getExtensions(), full);
        return json;
    }

    // ---------------------------------------------------------------- helpers

    private static void put(JsonObject json, String key, String value) {
        if (value != null) {
            json.addProperty(key, value);
        }
    }

    private static void putExtensions(JsonObject json, Map<String, JsonElement> extensions, boolean full) {
        if (!full) {
            return;
        }
        for (Map.Entry<String, JsonElement> entry : extensions.entrySet()) {
            if (!json.has(entry.getKey())) {
                json.add(entry.getKey(), entry.getValue());
            }
        }
    }

    private static String asString(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static Long asLong(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        try {
            if (primitive.isNumber()) {
                return primitive.getAsNumber().longValue();
            }
            if (primitive.isString()) {
                return Long.parseLong(primitive.getAsString().trim());
            }
        } catch (NumberFormatException e) {
            logger.debug("Not a size value: {}", primitive);
        }
        return null;
    }

    private static Boolean asBoolean(JsonElement value) {
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
            return null;
        }
        return value.getAsBoolean();
    }

    private static List<String> asStringList(JsonElement value) {
        if (!value.isJsonArray()) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (JsonElement element : value.getAsJsonArray()) {
            String text = asString(element);
            if (text == null) {
                return null;
            }
            result.add(text);
        }
        return result;
    }
}
