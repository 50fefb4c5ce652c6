package com.contrastsecurity.appsource.ipa;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads identity, version and permission metadata out of a package file.
 */
public interface PackageInspector {

    /**
     * @param packageFile the downloaded file
     * @param extractTwice the file is a zip archive wrapping exactly one package
     */
    PackageMetadata inspect(Path packageFile, boolean extractTwice) throws PackageInspectionException, IOException;
}
