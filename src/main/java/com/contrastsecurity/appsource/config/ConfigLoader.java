package com.contrastsecurity.appsource.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Reads {@link UpdateConfig} files.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Gson gson = new Gson();

    private ConfigLoader() {
        // Utility class - prevent instantiation
    }

    public static UpdateConfig load(Path path) throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public static UpdateConfig parse(String json) throws ConfigurationException {
        return parse(new java.io.StringReader(json), "<string>");
    }

    private static UpdateConfig parse(Reader reader, String origin) throws ConfigurationException {
        UpdateConfig config;
        try {
            config = gson.fromJson(reader, UpdateConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Empty configuration " + origin);
        }
        if (config.getHttp() == null) {
            config.setHttp(new HttpSettings());
        }
        if (config.getSources() == null) {
            config.setSources(new ArrayList<>());
        }
        if (config.getOverrides() == null) {
            config.setOverrides(new LinkedHashMap<>());
        }
        for (int i = 0; i < config.getSources().size(); i++) {
            ProviderConfig source = config.getSources().get(i);
            if (source == null || source.getKind() == null) {
                throw new ConfigurationException("Source #" + (i + 1) + " in " + origin + " has no kind");
            }
        }
        logger.debug("Loaded {} source(s) from {}", config.getSources().size(), origin);
        return config;
    }
}
