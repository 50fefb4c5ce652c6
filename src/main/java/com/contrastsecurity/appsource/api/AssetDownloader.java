package com.contrastsecurity.appsource.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Downloads release assets into temporary files. The caller deletes the file.
 */
public interface AssetDownloader {

    Path download(String url) throws IOException;
}
