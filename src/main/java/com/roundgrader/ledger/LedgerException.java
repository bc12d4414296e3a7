package com.roundgrader.ledger;

/**
 * Unchecked wrapper for every SQL failure raised by the ledger.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerException(String message) {
        super(message);
    }
}
