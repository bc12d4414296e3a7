package com.roundgrader.utils;

/**
 * Small string helpers shared by the ledger writers and HTTP outcome reporting.
 */
public final class TextUtils {

    private TextUtils() {}

    /**
     * Cut text down to at most {@code maxLength} characters. Null stays null.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }

    /**
     * Request id used in log lines: {@code {taskId}-r{round}}.
     */
    public static String requestId(String taskId, int round) {
        return taskId + "-r" + round;
    }
}
