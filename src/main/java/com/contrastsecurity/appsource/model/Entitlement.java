package com.contrastsecurity.appsource.model;

import com.google.gson.JsonElement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A code-signing entitlement an app requests.
 */
public class Entitlement {
    private String name;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public Entitlement() {
    }

    public Entitlement(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    public boolean isValid() {
        return name != null;
    }

    public Entitlement copy() {
        Entitlement copy = new Entitlement(name);
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }

    @Override
    public String toString() {
        return name;
    }
}
