package com.contrastsecurity.appsource.api;

import com.contrastsecurity.appsource.config.UploadTarget;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Publishes a package file somewhere it can be downloaded from.
 */
public interface ReleaseUploader {

    /**
     * @return the public download URL of the uploaded file
     */
    String upload(Path file, String assetName, UploadTarget target) throws IOException;
}
