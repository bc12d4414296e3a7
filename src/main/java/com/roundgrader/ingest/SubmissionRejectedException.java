package com.roundgrader.ingest;

/**
 * A submission failed validation and was not stored. Maps to an HTTP 400 response.
 */
public class SubmissionRejectedException extends RuntimeException {

    public enum Reason {
        INVALID,
        NONCE_NOT_FOUND,
        IDENTITY_MISMATCH,
        DUPLICATE
    }

    private final Reason reason;

    public SubmissionRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
