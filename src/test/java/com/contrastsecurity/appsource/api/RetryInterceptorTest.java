package com.contrastsecurity.appsource.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RetryInterceptorTest {

    @Test
    public void testRetryableStatusCodes() {
        assertTrue(RetryInterceptor.isRetryable(429));
        assertTrue(RetryInterceptor.isRetryable(500));
        assertTrue(RetryInterceptor.isRetryable(503));
        assertFalse(RetryInterceptor.isRetryable(200));
        assertFalse(RetryInterceptor.isRetryable(404));
        assertFalse(RetryInterceptor.isRetryable(403));
    }
}
