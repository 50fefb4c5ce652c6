package com.contrastsecurity.appsource.api;

import java.io.IOException;

/**
 * A request completed with a non-successful HTTP status.
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String url;
    private final String apiMessage;

    public HttpStatusException(int statusCode, String url, String message) {
        super(message != null && !message.isEmpty()
                ? "HTTP " + statusCode + " from " + url + ": " + message
                : "HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
        this.url = url;
        this.apiMessage = message;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return the {@code message} field of a JSON error body, or null
     */
    public String getApiMessage() {
        return apiMessage;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
