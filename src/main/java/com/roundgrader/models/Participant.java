package com.roundgrader.models;

/**
 * One row of the participants CSV: where to deliver tasks and the shared secret to send along.
 */
public record Participant(String timestamp, String email, String endpoint, String secret) {
}
