package com.contrastsecurity.appsource.service;

import com.contrastsecurity.appsource.CatalogException;

public class EnrichmentException extends CatalogException {

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
