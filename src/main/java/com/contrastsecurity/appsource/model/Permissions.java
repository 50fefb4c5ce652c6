package com.contrastsecurity.appsource.model;

import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entitlements and privacy usage declared by an app.
 */
public class Permissions {
    private List<Entitlement> entitlements;
    private List<PrivacyPermission> privacy;
    private final Map<String, JsonElement> extensions = new LinkedHashMap<>();

    public Permissions() {
        this(new ArrayList<>(), new ArrayList<>());
    }

    public Permissions(List<Entitlement> entitlements, List<PrivacyPermission> privacy) {
        this.entitlements = entitlements;
        this.privacy = privacy;
    }

    /**
     * @return the entitlements, null when the document omitted the section
     */
    public List<Entitlement> getEntitlements() {
        return entitlements;
    }

    public void setEntitlements(List<Entitlement> entitlements) {
        this.entitlements = entitlements;
    }

    /**
     * @return the privacy permissions, null when the document omitted the section
     */
    public List<PrivacyPermission> getPrivacy() {
        return privacy;
    }

    public void setPrivacy(List<PrivacyPermission> privacy) {
        this.privacy = privacy;
    }

    public Map<String, JsonElement> getExtensions() {
        return extensions;
    }

    /**
     * Privacy entries whose name is not a known category.
     */
    public List<PrivacyPermission> unknownPrivacyCategories() {
        List<PrivacyPermission> unknown = new ArrayList<>();
        if (privacy != null) {
            for (PrivacyPermission permission : privacy) {
                if (!permission.isKnownCategory()) {
                    unknown.add(permission);
                }
            }
        }
        return unknown;
    }

    public boolean isValid() {
        if (entitlements != null) {
            for (Entitlement entitlement : entitlements) {
                if (!entitlement.isValid()) {
                    return false;
                }
            }
        }
        if (privacy != null) {
            for (PrivacyPermission permission : privacy) {
                if (!permission.isValid()) {
                    return false;
                }
            }
        }
        return true;
    }

    public Permissions copy() {
        List<Entitlement> entitlementsCopy = null;
        if (entitlements != null) {
            entitlementsCopy = new ArrayList<>();
            for (Entitlement entitlement : entitlements) {
                entitlementsCopy.add(entitlement.copy());
            }
        }
        List<PrivacyPermission> privacyCopy = null;
        if (privacy != null) {
            privacyCopy = new ArrayList<>();
            for (PrivacyPermission permission : privacy) {
                privacyCopy.add(permission.copy());
            }
        }
        Permissions copy = new Permissions(entitlementsCopy, privacyCopy);
        extensions.forEach((key, value) -> copy.extensions.put(key, value.deepCopy()));
        return copy;
    }
}
