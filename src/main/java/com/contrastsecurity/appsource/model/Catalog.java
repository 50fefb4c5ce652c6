package com.contrastsecurity.appsource.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The top-level catalog document ("source"): apps in display order plus optional news.
 *
 * The catalog owns its apps and articles exclusively. Nothing in this project removes
 * an app or a version once it has been added.
 */
public class Catalog {
    public static final String CURRENT_API_VERSION = "v2";
    public static final List<String> REQUIRED_KEYS =
            Collections.unmodifiableList(List.of("name", "identifier", "apps"));

    private String name;
    private String identifier;
    private String apiVersion;
    private String subtitle;
    private String description;
    private String iconURL;
    private String headerURL;
    private String website;
    private String tintColor;
    private List<String> featuredApps;
    private List<App> apps = new ArrayList<>();
    private List<NewsArticle> news;
    private JsonObject userinfo;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public Catalog() {
    }

    /**
     * A new, empty catalog on the current schema.
     */
    public static Catalog create(String name, String identifier) {
        Catalog catalog = new Catalog();
        catalog.name = name;
        catalog.identifier = identifier;
        catalog.apiVersion = CURRENT_API_VERSION;
        catalog.news = new ArrayList<>();
        return catalog;
    }

    /**
     * @return the position of the app whose identity key is {@code id}, or -1
     */
    public int indexOfApp(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < apps.size(); i++) {
            if (id.equals(apps.get(i).getIdentityKey())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return the app whose identity key is {@code id}, or null
     */
    public App findApp(String id) {
        int index = indexOfApp(id);
        return index >= 0 ? apps.get(index) : null;
    }

    /**
     * Identity keys of all apps in display order.
     */
    public List<String> getAppIds() {
        List<String> ids = new ArrayList<>();
        for (App app : apps) {
            ids.add(app.getIdentityKey());
        }
        return ids;
    }

    public int indexOfArticle(String identifier) {
        if (news == null || identifier == null) {
            return -1;
        }
        for (int i = 0; i < news.size(); i++) {
            if (identifier.equals(news.get(i).getIdentifier())) {
                return i;
            }
        }
        return -1;
    }

    public void addArticle(NewsArticle article) {
        if (news == null) {
            news = new ArrayList<>();
        }
        news.add(article);
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (name == null || name.isEmpty()) missing.add("name");
        if (identifier == null || identifier.isEmpty()) missing.add("identifier");
        if (apps == null) missing.add("apps");
        return missing;
    }

    public boolean isValid() {
        for (App app : apps) {
            if (!app.isValid()) {
                return false;
            }
        }
        if (news != null) {
            for (NewsArticle article : news) {
                if (!article.isValid()) {
                    return false;
                }
            }
        }
        return missingKeys().isEmpty();
    }

    /**
     * Deep copy, used to roll back a failed update step.
     */
    public Catalog copy() {
        Catalog copy = new Catalog();
        copy.restore(this);
        return copy;
    }

    /**
     * Make this catalog an exact deep copy of {@code snapshot}.
     */
    public void restore(Catalog snapshot) {
        name = snapshot.name;
        identifier = snapshot.identifier;
        apiVersion = snapshot.apiVersion;
        subtitle = snapshot.subtitle;
        description = snapshot.description;
        iconURL = snapshot.iconURL;
        headerURL = snapshot.headerURL;
        website = snapshot.website;
        tintColor = snapshot.tintColor;
        featuredApps = snapshot.featuredApps != null ? new ArrayList<>(snapshot.featuredApps) : null;
        apps = new ArrayList<>();
        for (App app : snapshot.apps) {
            apps.add(app.copy());
        }
        if (snapshot.news != null) {
            news = new ArrayList<>();
            for (NewsArticle article : snapshot.news) {
                news.add(article.copy());
            }
        } else {
            news = null;
        }
        userinfo = snapshot.userinfo != null ? snapshot.userinfo.deepCopy() : null;
        extensions.clear();
        snapshot.extensions.forEach((key, value) -> extensions.put(key, value.deepCopy()));
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Schema generation tag, {@value #CURRENT_API_VERSION} for documents written by this tool.
     */
    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public void setSubtitle(String subtitle) {
        this.subtitle = subtitle;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getIconURL() {
        return iconURL;
    }

    public void setIconURL(String iconURL) {
        this.iconURL = iconURL;
    }

    public String getHeaderURL() {
        return headerURL;
    }

    public void setHeaderURL(String headerURL) {
        this.headerURL = headerURL;
    }

    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = website;
    }

    public String getTintColor() {
        return tintColor;
    }

    public void setTintColor(String tintColor) {
        this.tintColor = tintColor;
    }

    public List<String> getFeaturedApps() {
        return featuredApps;
    }

    public void setFeaturedApps(List<String> featuredApps) {
        this.featuredApps = featuredApps;
    }

    public List<App> getApps() {
        return apps;
    }

    public void setApps(List<App> apps) {
        this.apps = apps;
    }

    /**
     * @return the articles, null when the document has no news section
     */
    public List<NewsArticle> getNews() {
        return news;
    }

    public void setNews(List<NewsArticle> news) {
        this.news = news;
    }

    public JsonObject getUserinfo() {
        return userinfo;
    }

    public void setUserinfo(JsonObject userinfo) {
        this.userinfo = userinfo;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return name + " (" + identifier + ", " + apps.size() + " apps)";
    }
}
