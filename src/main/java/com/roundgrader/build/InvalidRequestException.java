package com.roundgrader.build;

/**
 * A build or revise request failed field validation.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
