package com.nilsson.promptextractor.service;

import java.nio.file.Path;

/**
 Thrown when a file cannot be opened as an image container.
 */
public class DecodeException extends Exception {

    private final transient Path file;

    public DecodeException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
