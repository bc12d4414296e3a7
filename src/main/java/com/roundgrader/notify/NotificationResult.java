package com.roundgrader.notify;

/**
 * Outcome of reporting a submission to a grading collector.
 * {@code statusCode} is 0 when no HTTP response was received.
 */
public record NotificationResult(boolean success, int statusCode, int attempts, String error, String responseBody) {
}
