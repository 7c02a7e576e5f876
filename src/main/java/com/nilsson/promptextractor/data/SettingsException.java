package com.nilsson.promptextractor.data;

/**
 Raised when extractor settings cannot be read or fail validation.
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
