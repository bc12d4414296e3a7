package com.roundgrader.build;

import com.roundgrader.utils.TextUtils;

import java.util.regex.Pattern;

/**
 * Field checks applied to build and revise requests before any work starts.
 */
public final class RequestValidator {
    private static final Pattern EMAIL = Pattern.compile("^[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+$");
    private static final Pattern HTTP_URL = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);

    static final int MIN_SECRET_LENGTH = 8;
    static final int MIN_TASK_LENGTH = 3;
    static final int MIN_BRIEF_LENGTH = 10;

    private RequestValidator() {}

    public static void validate(BuildRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        if (TextUtils.isBlank(request.email) || !EMAIL.matcher(request.email.trim()).matches()) {
            throw new InvalidRequestException("Invalid email format");
        }
        if (request.secret == null || request.secret.length() < MIN_SECRET_LENGTH) {
            throw new InvalidRequestException("Secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (request.task == null || request.task.trim().length() < MIN_TASK_LENGTH) {
            throw new InvalidRequestException("Task ID must be at least " + MIN_TASK_LENGTH + " characters");
        }
        if (request.round == null || request.round < 1) {
            throw new InvalidRequestException("Round must be a positive integer");
        }
        if (TextUtils.isBlank(request.nonce)) {
            throw new InvalidRequestException("Nonce cannot be empty");
        }
        if (request.brief == null || request.brief.trim().length() < MIN_BRIEF_LENGTH) {
            throw new InvalidRequestException("Brief must be at least " + MIN_BRIEF_LENGTH + " characters");
        }
        if (request.checks == null || request.checks.isEmpty()) {
            throw new InvalidRequestException("At least one check is required");
        }
        if (TextUtils.isBlank(request.evaluationUrl) || !HTTP_URL.matcher(request.evaluationUrl.trim()).matches()) {
            throw new InvalidRequestException("Evaluation URL must start with http:// or https://");
        }
    }

    public static void validateRevision(BuildRequest request) {
        validate(request);
        if (request.round < 2) {
            throw new InvalidRequestException("Revision requests must have round >= 2");
        }
    }
}
