package org.assertflat;

import java.nio.file.Path;

public class MigrationException extends AssertFlatException {

    private final Path path;

    public MigrationException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
