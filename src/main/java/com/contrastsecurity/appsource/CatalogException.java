package com.contrastsecurity.appsource;

/**
 * Base class for failures while maintaining a catalog.
 */
public class CatalogException extends Exception {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
