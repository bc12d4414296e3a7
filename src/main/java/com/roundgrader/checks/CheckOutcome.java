package com.roundgrader.checks;

/**
 * Score in [0, 1] for one check, with a human-readable reason and a short evidence excerpt.
 */
public record CheckOutcome(String name, double score, String reason, String logs) {

    public static final int MAX_LOG_LENGTH = 500;

    public CheckOutcome {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        if (logs == null) {
            logs = "";
        } else if (logs.length() > MAX_LOG_LENGTH) {
            logs = logs.substring(0, MAX_LOG_LENGTH);
        }
    }

    public static CheckOutcome failed(String name, String reason) {
        return new CheckOutcome(name, 0.0, reason, "");
    }
}
