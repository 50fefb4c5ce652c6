package com.contrastsecurity.appsource.api;

import com.contrastsecurity.appsource.config.HttpSettings;
import com.contrastsecurity.appsource.config.UploadTarget;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Client for everything that leaves the process: remote catalog documents, release
 * listings, asset downloads and asset uploads to GitHub releases.
 */
public class UpstreamClient implements DocumentFetcher, AssetDownloader, ReleaseUploader, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UpstreamClient.class);
    private static final String GITHUB_API = "https://api.github.com";
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final String GITHUB_ACCEPT = "application/vnd.github+json";

    private final OkHttpClient client;
    private final ExecutorService executorService;

    public UpstreamClient() {
        this(new HttpSettings());
    }

    public UpstreamClient(HttpSettings settings) {
        OkHttpClient.Builder clientBuilder = HttpClients.createHttpClientBuilder(settings);

        // Create a dispatcher with a custom executor service that we can shut down later
        Dispatcher dispatcher = new Dispatcher();
        this.executorService = dispatcher.executorService();
        clientBuilder.dispatcher(dispatcher);

        this.client = clientBuilder.build();
    }

    /**
     * The GitHub releases listing of a repository.
     */
    public static String releasesUrl(String owner, String repo) {
        return String.format("%s/repos/%s/%s/releases", GITHUB_API, owner, repo);
    }

    static boolean isRemote(String location) {
        return location.startsWith("http://") || location.startsWith("https://");
    }

    @Override
    public JsonElement fetch(String location) throws IOException {
        if (!isRemote(location)) {
            Path path = Paths.get(location);
            if (!Files.isRegularFile(path)) {
                throw new NoSuchFileException(location);
            }
            logger.debug("Reading document {}", path);
            return JsonParser.parseString(Files.readString(path, StandardCharsets.UTF_8));
        }

        logger.debug("Fetching document {}", location);
        Request request = new Request.Builder()
                .url(location)
                .header("Accept", isGitHubApi(location) ? GITHUB_ACCEPT : "application/json")
                .get()
                .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new HttpStatusException(response.code(), location, extractMessage(body));
            }
            return JsonParser.parseString(body);
        }
    }

    @Override
    public Path download(String url) throws IOException {
        logger.debug("Downloading {}", url);
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new HttpStatusException(response.code(), url, null);
            }
            Path tempFile = Files.createTempFile("appsource-", ".download");
            try (InputStream in = body.byteStream()) {
                Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                Files.deleteIfExists(tempFile);
                throw e;
            }
            logger.debug("Downloaded {} bytes to {}", Files.size(tempFile), tempFile);
            return tempFile;
        }
    }

    /**
     * Upload a file to the latest release of the target repository.
     */
    @Override
    public String upload(Path file, String assetName, UploadTarget target) throws IOException {
        String latestUrl = String.format("%s/repos/%s/%s/releases/latest", GITHUB_API, target.getOwner(), target.getRepo());
        JsonElement latest = fetch(latestUrl);
        if (!latest.isJsonObject() || !latest.getAsJsonObject().has("upload_url")) {
            throw new IOException("No latest release found in " + target);
        }
        String uploadTemplate = latest.getAsJsonObject().get("upload_url").getAsString();
        int templateStart = uploadTemplate.indexOf('{');
        String uploadBase = templateStart >= 0 ? uploadTemplate.substring(0, templateStart) : uploadTemplate;
        HttpUrl uploadUrl = HttpUrl.get(uploadBase).newBuilder().addQueryParameter("name", assetName).build();

        logger.info("Uploading {} to {} as {}", file.getFileName(), target, assetName);
        Request request = new Request.Builder()
                .url(uploadUrl)
                .header("Accept", GITHUB_ACCEPT)
                .post(RequestBody.create(file.toFile(), OCTET_STREAM))
                .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new HttpStatusException(response.code(), uploadUrl.toString(), extractMessage(body));
            }
            JsonObject asset = JsonParser.parseString(body).getAsJsonObject();
            return asset.get("browser_download_url").getAsString();
        }
    }

    private static boolean isGitHubApi(String location) {
        return location.startsWith(GITHUB_API);
    }

    /**
     * Pull the {@code message} field out of a JSON error body.
     */
    static String extractMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            if (element.isJsonObject() && element.getAsJsonObject().has("message")) {
                return element.getAsJsonObject().get("message").getAsString();
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logger.debug("Error body is not JSON: {}", e.getMessage());
        }
        return null;
    }

    /**
     * Closes the client and releases resources
     */
    @Override
    public void close() {
        client.dispatcher().cancelAll();
        client.connectionPool().evictAll();
        client.dispatcher().executorService().shutdown();

        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Failed to terminate OkHttp threads cleanly");
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Thread shutdown interrupted", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }
}
