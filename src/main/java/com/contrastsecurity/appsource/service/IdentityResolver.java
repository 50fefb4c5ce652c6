package com.contrastsecurity.appsource.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the {@code ids} list of a provider configuration into lookup structures.
 *
 * Each entry is either a plain id ({@code "com.example.app"}) or a single-entry remap
 * {@code {"desired.app.id": "upstream.bundle.id"}}. A remap lets a catalog keep its own
 * appID for an app whose bundle identifier differs upstream.
 */
public final class IdentityResolver {
    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private IdentityResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * @param ids plain strings and single-entry maps, or null for "no filter"
     */
    public static ResolvedIds resolve(List<?> ids) {
        if (ids == null) {
            return ResolvedIds.UNFILTERED;
        }
        List<String> fetchKeys = new ArrayList<>();
        List<String> identityKeys = new ArrayList<>();
        Map<String, String> appIdByUpstreamId = new LinkedHashMap<>();
        for (Object entry : ids) {
            if (entry instanceof String) {
                fetchKeys.add((String) entry);
                identityKeys.add((String) entry);
            } else if (entry instanceof Map) {
                for (Map.Entry<?, ?> mapping : ((Map<?, ?>) entry).entrySet()) {
                    String appId = String.valueOf(mapping.getKey());
                    String upstreamId = String.valueOf(mapping.getValue());
                    fetchKeys.add(upstreamId);
                    identityKeys.add(appId);
                    appIdByUpstreamId.put(upstreamId, appId);
                }
            } else {
                logger.debug("Ignoring id entry of unexpected type: {}", entry);
            }
        }
        return new ResolvedIds(fetchKeys, identityKeys, appIdByUpstreamId);
    }

    /**
     * Result of {@link IdentityResolver#resolve(List)}.
     */
    public static final class ResolvedIds {
        static final ResolvedIds UNFILTERED = new ResolvedIds(null, null, Collections.emptyMap());

        private final List<String> fetchKeys;
        private final List<String> identityKeys;
        private final Map<String, String> appIdByUpstreamId;

        ResolvedIds(List<String> fetchKeys, List<String> identityKeys, Map<String, String> appIdByUpstreamId) {
            this.fetchKeys = fetchKeys != null ? Collections.unmodifiableList(fetchKeys) : null;
            this.identityKeys = identityKeys != null ? Collections.unmodifiableList(identityKeys) : null;
            this.appIdByUpstreamId = Collections.unmodifiableMap(appIdByUpstreamId);
        }

        public boolean isFiltered() {
            return fetchKeys != null;
        }

        /**
         * Ids as they appear upstream: plain ids and the bundle identifiers of remaps.
         * Null when unfiltered.
         */
        public List<String> getFetchKeys() {
            return fetchKeys;
        }

        /**
         * Ids as they should appear in the catalog: plain ids and the appIDs of remaps.
         * Null when unfiltered.
         */
        public List<String> getIdentityKeys() {
            return identityKeys;
        }

        public Map<String, String> getAppIdByUpstreamId() {
            return appIdByUpstreamId;
        }

        /**
         * @return true if the id was listed as a plain id, or there is no filter at all
         */
        public boolean isVerbatim(String upstreamId) {
            return fetchKeys == null || !appIdByUpstreamId.containsKey(upstreamId) && fetchKeys.contains(upstreamId);
        }

        /**
         * The appID to assign to an app known upstream as {@code upstreamId}.
         */
        public String appIdFor(String upstreamId) {
            if (isVerbatim(upstreamId)) {
                return upstreamId;
            }
            return appIdByUpstreamId.get(upstreamId);
        }

        public boolean accepts(String upstreamId) {
            return fetchKeys == null || fetchKeys.contains(upstreamId);
        }

        public int size() {
            return fetchKeys != null ? fetchKeys.size() : 0;
        }

        @Override
        public String toString() {
            return isFiltered() ? "ResolvedIds{fetch=" + fetchKeys + ", remap=" + appIdByUpstreamId + '}' : "ResolvedIds{all}";
        }
    }
}
