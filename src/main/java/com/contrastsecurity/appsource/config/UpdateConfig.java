package com.contrastsecurity.appsource.config;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level update configuration file.
 */
public class UpdateConfig {
    private HttpSettings http = new HttpSettings();
    private List<ProviderConfig> sources = new ArrayList<>();
    private boolean updateHashes;
    private Map<String, JsonObject> overrides = new LinkedHashMap<>();

    public HttpSettings getHttp() {
        return http;
    }

    public void setHttp(HttpSettings http) {
        this.http = http;
    }

    public List<ProviderConfig> getSources() {
        return sources;
    }

    public void setSources(List<ProviderConfig> sources) {
        this.sources = sources;
    }

    /**
     * Backfill hashes and permissions of every latest version after the update.
     */
    public boolean isUpdateHashes() {
        return updateHashes;
    }

    public void setUpdateHashes(boolean updateHashes) {
        this.updateHashes = updateHashes;
    }

    /**
     * Per-app JSON fragments merged over the app after the update, keyed by app id.
     */
    public Map<String, JsonObject> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, JsonObject> overrides) {
        this.overrides = overrides;
    }
}
