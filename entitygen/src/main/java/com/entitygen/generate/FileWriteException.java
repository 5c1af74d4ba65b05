package com.entitygen.generate;

import com.entitygen.EntitygenException;

import java.io.IOException;
import java.nio.file.Path;

public class FileWriteException extends EntitygenException {
    private final Path path;

    public FileWriteException(Path path, IOException cause) {
        super("Cannot write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public FileWriteException(Path path, String message) {
        super("Cannot write " + path + ": " + message);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
