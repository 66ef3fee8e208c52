package org.caureq.opsanomaly.service;

import java.nio.file.Path;

public class ArtifactException extends RuntimeException {
    private final Path path;

    public ArtifactException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() { return path; }
}
