package com.contrastsecurity.appsource.ipa;

import java.io.IOException;
import java.nio.file.Path;

public interface ContentHasher {

    /**
     * @return lowercase hex SHA-256 digest of the file
     */
    String sha256(Path file) throws IOException;
}
