package com.roundgrader.dispatch;

/**
 * Final result of delivering one task: the last status seen (0 for a transport failure),
 * how many attempts were made and the last error, if any.
 */
public record DispatchOutcome(boolean delivered, int statusCode, int attempts, String error) {

    public static DispatchOutcome delivered(int attempts) {
        return new DispatchOutcome(true, 200, attempts, null);
    }

    public static DispatchOutcome failed(int statusCode, int attempts, String error) {
        return new DispatchOutcome(false, statusCode, attempts, error);
    }
}
