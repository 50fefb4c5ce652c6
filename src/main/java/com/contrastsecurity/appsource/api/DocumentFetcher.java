package com.contrastsecurity.appsource.api;

import com.google.gson.JsonElement;

import java.io.IOException;

/**
 * Loads a JSON document from a local path or an http(s) URL.
 */
public interface DocumentFetcher {

    /**
     * @param location file path or URL
     * @return the parsed document
     * @throws java.nio.file.NoSuchFileException if a local file does not exist
     * @throws HttpStatusException if the server answers with an error status
     * @throws com.google.gson.JsonParseException if the content is not JSON
     */
    JsonElement fetch(String location) throws IOException;
}
