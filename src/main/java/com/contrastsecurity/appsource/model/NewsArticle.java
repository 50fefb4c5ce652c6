package com.contrastsecurity.appsource.model;

import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A news entry shown alongside a catalog. {@code identifier} is unique within a catalog.
 */
public class NewsArticle {
    public static final List<String> REQUIRED_KEYS =
            Collections.unmodifiableList(List.of("title", "identifier", "caption", "date"));

    private String identifier;
    private String title;
    private String caption;
    private String date;
    private String imageURL;
    private String tintColor;
    private Boolean notify;
    private String url;
    private String appID;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public NewsArticle() {
    }

    public NewsArticle(String identifier, String title, String caption, String date) {
        this.identifier = identifier;
        this.title = title;
        this.caption = caption;
        this.date = date;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCaption() {
        return caption;
    }

    public void setCaption(String caption) {
        this.caption = caption;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getImageURL() {
        return imageURL;
    }

    public void setImageURL(String imageURL) {
        this.imageURL = imageURL;
    }

    public String getTintColor() {
        return tintColor;
    }

    public void setTintColor(String tintColor) {
        this.tintColor = tintColor;
    }

    public Boolean getNotify() {
        return notify;
    }

    public void setNotify(Boolean notify) {
        this.notify = notify;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    /**
     * The app this article refers to. Not required to exist in the catalog.
     */
    public String getAppID() {
        return appID;
    }

    public void setAppID(String appID) {
        this.appID = appID;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (title == null) missing.add("title");
        if (identifier == null) missing.add("identifier");
        if (caption == null) missing.add("caption");
        if (date == null) missing.add("date");
        return missing;
    }

    public boolean isValid() {
        return missingKeys().isEmpty();
    }

    public NewsArticle copy() {
        NewsArticle copy = new NewsArticle(identifier, title, caption, date);
        copy.imageURL = imageURL;
        copy.tintColor = tintColor;
        copy.notify = notify;
        copy.url = url;
        copy.appID = appID;
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }

    @Override
    public String toString() {
        return identifier + ": " + title;
    }
}
