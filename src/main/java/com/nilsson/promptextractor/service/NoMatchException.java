package com.nilsson.promptextractor.service;

import java.nio.file.Path;

/**
 Thrown when an image was readable but none of its annotations yielded a prompt.
 */
public class NoMatchException extends Exception {

    private final transient Path file;

    public NoMatchException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
