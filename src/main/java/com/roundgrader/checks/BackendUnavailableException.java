package com.roundgrader.checks;

/**
 * The interactive backend could not be started; the engine falls back to static parsing.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackendUnavailableException(String message) {
        super(message);
    }
}
