package com.contrastsecurity.appsource.model;

import com.contrastsecurity.appsource.constants.PrivacyCategory;
import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A privacy-sensitive capability and the reason shown to the user.
 *
 * Names outside {@link PrivacyCategory} are kept; {@link #isKnownCategory()} lets
 * callers flag them.
 */
public class PrivacyPermission {
    private String name;
    private String usageDescription;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public PrivacyPermission() {
    }

    public PrivacyPermission(String name, String usageDescription) {
        this.name = name;
        this.usageDescription = usageDescription;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUsageDescription() {
        return usageDescription;
    }

    public void setUsageDescription(String usageDescription) {
        this.usageDescription = usageDescription;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    public boolean isKnownCategory() {
        return PrivacyCategory.fromString(name) != null;
    }

    public List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (name == null) missing.add("name");
        if (usageDescription == null) missing.add("usageDescription");
        return missing;
    }

    public boolean isValid() {
        return missingKeys().isEmpty();
    }

    public PrivacyPermission copy() {
        PrivacyPermission copy = new PrivacyPermission(name, usageDescription);
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }

    @Override
    public String toString() {
        return name + ": " + usageDescription;
    }
}
