package com.nilsson.promptextractor.model;

/**
 Why a single file produced no prompt.
 */
public enum FailureReason {
    /** The file could not be opened or is not a valid image container. */
    DECODE_ERROR,
    /** The container was readable but carried no recognizable prompt text. */
    NO_MATCH,
    /** Any other fault raised inside the worker task. */
    UNEXPECTED
}
