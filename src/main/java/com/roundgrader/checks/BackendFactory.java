package com.roundgrader.checks;

/**
 * Creates a fresh backend for one evaluation.
 */
@FunctionalInterface
public interface BackendFactory {

    CheckBackend open() throws BackendUnavailableException;
}
