package com.contrastsecurity.appsource.api;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Retries requests that failed with an I/O error, HTTP 429 or a 5xx status.
 *
 * The delay grows linearly: {@code backoffMillis * attempt}.
 */
public class RetryInterceptor implements Interceptor {
    private static final Logger logger = LoggerFactory.getLogger(RetryInterceptor.class);

    private final int maxRetries;
    private final long backoffMillis;

    public RetryInterceptor(int maxRetries, long backoffMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffMillis = Math.max(0, backoffMillis);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        IOException lastFailure = null;
        for (int attempt = 0; ; attempt++) {
            try {
                Response response = chain.proceed(request);
                if (!isRetryable(response.code()) || attempt >= maxRetries) {
                    return response;
                }
                logger.debug("{} {} returned {}, retrying ({}/{})",
                        request.method(), request.url(), response.code(), attempt + 1, maxRetries);
                response.close();
            } catch (InterruptedIOException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                lastFailure = e;
                logger.debug("{} {} timed out, retrying ({}/{})", request.method(), request.url(), attempt + 1, maxRetries);
            } catch (IOException e) {
                if (attempt >= maxRetries || chain.call().isCanceled()) {
                    throw e;
                }
                lastFailure = e;
                logger.debug("{} {} failed: {}, retrying ({}/{})",
                        request.method(), request.url(), e.getMessage(), attempt + 1, maxRetries);
            }
            sleep(backoffMillis * (attempt + 1), lastFailure);
        }
    }

    static boolean isRetryable(int code) {
        return code == 429 || code >= 500;
    }

    private static void sleep(long millis, IOException lastFailure) throws IOException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting to retry");
            if (lastFailure != null) {
                interrupted.addSuppressed(lastFailure);
            }
            throw interrupted;
        }
    }
}
