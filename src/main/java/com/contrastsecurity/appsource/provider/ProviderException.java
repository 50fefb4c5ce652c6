package com.contrastsecurity.appsource.provider;

import com.contrastsecurity.appsource.CatalogException;

/**
 * An upstream provider could not deliver its data: network or API errors, a missing
 * repository or document, no qualifying release or asset.
 */
public class ProviderException extends CatalogException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
