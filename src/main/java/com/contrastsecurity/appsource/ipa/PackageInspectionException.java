package com.contrastsecurity.appsource.ipa;

import com.contrastsecurity.appsource.CatalogException;

/**
 * The package file is not a readable app archive.
 */
public class PackageInspectionException extends CatalogException {

    public PackageInspectionException(String message) {
        super(message);
    }

    public PackageInspectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
