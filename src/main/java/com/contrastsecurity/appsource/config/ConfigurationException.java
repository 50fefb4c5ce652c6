package com.contrastsecurity.appsource.config;

import com.contrastsecurity.appsource.CatalogException;

/**
 * A configuration entry (or the whole configuration file) cannot be used.
 */
public class ConfigurationException extends CatalogException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
