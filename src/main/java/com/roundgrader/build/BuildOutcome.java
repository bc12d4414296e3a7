package com.roundgrader.build;

/**
 * Result of a build or revise run. {@code notificationSent=false} with {@code success=true}
 * means the application is live but the grading collector was never told.
 */
public record BuildOutcome(boolean success, String message, String repoUrl, String pagesUrl, String commitSha,
                           boolean notificationSent, int notificationAttempts, String error) {

    public static BuildOutcome failed(String message, String error) {
        return new BuildOutcome(false, message, null, null, null, false, 0, error);
    }

    public boolean hasWarning() {
        return success && !notificationSent;
    }
}
