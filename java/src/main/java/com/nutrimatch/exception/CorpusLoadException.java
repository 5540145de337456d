package com.nutrimatch.exception;

/**
 * A data file exists but could not be read or parsed.
 */
public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String file, Throwable cause) {
        super(String.format("Failed to load data file '%s': %s", file, cause.getMessage()), cause);
    }
}
