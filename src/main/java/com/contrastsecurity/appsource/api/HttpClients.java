package com.contrastsecurity.appsource.api;

import com.contrastsecurity.appsource.config.HttpSettings;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Creates OkHttpClient instances with the configured timeouts, retry policy and
 * GitHub token.
 */
public class HttpClients {
    private static final Logger logger = LoggerFactory.getLogger(HttpClients.class);

    static final String GITHUB_API_HOST = "api.github.com";
    static final String GITHUB_UPLOAD_HOST = "uploads.github.com";

    private HttpClients() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates an OkHttpClient.Builder with default timeouts and retries.
     */
    public static OkHttpClient.Builder createHttpClientBuilder() {
        return createHttpClientBuilder(new HttpSettings());
    }

    /**
     * Creates an OkHttpClient.Builder from the given settings. When the environment
     * variable named by {@link HttpSettings#getTokenEnv()} is set, its value is sent as
     * a bearer token to the GitHub API hosts and nowhere else.
     *
     * @param settings timeouts and retry policy
     * @return Configured OkHttpClient.Builder
     */
    public static OkHttpClient.Builder createHttpClientBuilder(HttpSettings settings) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(settings.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(settings.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(settings.getWriteTimeoutSeconds(), TimeUnit.SECONDS)
                .followRedirects(true)
                .retryOnConnectionFailure(false)
                .addInterceptor(new RetryInterceptor(settings.getMaxRetries(), settings.getRetryBackoffMillis()));

        String token = readToken(settings.getTokenEnv());
        if (token != null) {
            builder.addInterceptor(chain -> {
                Request request = chain.request();
                String host = request.url().host();
                if (GITHUB_API_HOST.equals(host) || GITHUB_UPLOAD_HOST.equals(host)) {
                    request = request.newBuilder().header("Authorization", "Bearer " + token).build();
                }
                return chain.proceed(request);
            });
            logger.debug("Using GitHub token from ${}", settings.getTokenEnv());
        }
        return builder;
    }

    static String readToken(String envName) {
        if (envName == null || envName.isEmpty()) {
            return null;
        }
        String token = System.getenv(envName);
        return token != null && !token.isBlank() ? token.trim() : null;
    }
}
