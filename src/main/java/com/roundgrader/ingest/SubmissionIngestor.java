package com.roundgrader.ingest;

import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import com.roundgrader.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.roundgrader.ingest.SubmissionRejectedException.Reason;

/**
 * Validates an incoming submission against the task its nonce names and records it.
 * A submission is stored only when the nonce resolves to a task with the same email, task id and
 * round, and no submission exists yet for that assignment.
 */
public class SubmissionIngestor {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionIngestor.class);

    private final Ledger ledger;

    public SubmissionIngestor(Ledger ledger) {
        this.ledger = ledger;
    }

    public Submission ingest(SubmissionRequest request) {
        validateFields(request);
        logger.info("Received submission from {} for task {} (round {})", request.email, request.task, request.round);

        Optional<Task> found = ledger.findTaskByNonce(request.nonce);
        if (found.isEmpty()) {
            logger.warn("Invalid nonce: {}", request.nonce);
            throw new SubmissionRejectedException(Reason.NONCE_NOT_FOUND, "Invalid nonce. Task not found.");
        }
        Task task = found.get();

        if (!task.getEmail().equals(request.email)) {
            logger.warn("Email mismatch: task has {}, request has {}", task.getEmail(), request.email);
            throw new SubmissionRejectedException(Reason.IDENTITY_MISMATCH, "Email does not match the task record.");
        }
        if (!task.getTaskId().equals(request.task)) {
            logger.warn("Task mismatch: task has {}, request has {}", task.getTaskId(), request.task);
            throw new SubmissionRejectedException(Reason.IDENTITY_MISMATCH, "Task ID does not match the task record.");
        }
        if (task.getRound() != request.round) {
            logger.warn("Round mismatch: task has {}, request has {}", task.getRound(), request.round);
            throw new SubmissionRejectedException(Reason.IDENTITY_MISMATCH,
                    "Round number does not match the task record.");
        }
        if (ledger.submissionExists(request.email, request.task, request.round)) {
            logger.warn("Repo already submitted: {} - {} (round {})", request.email, request.task, request.round);
            throw new SubmissionRejectedException(Reason.DUPLICATE,
                    "Repository has already been submitted for this task and round.");
        }

        Submission submission = new Submission(request.email, request.task, request.round, request.nonce,
                request.repoUrl, request.commitSha, request.pagesUrl);
        ledger.insertSubmission(submission);
        logger.info("[{}] Submission recorded for {}", TextUtils.requestId(request.task, request.round), request.email);
        return submission;
    }

    private static void validateFields(SubmissionRequest request) {
        if (request == null) {
            throw new SubmissionRejectedException(Reason.INVALID, "Request body is required");
        }
        requireText(request.email, "email");
        requireText(request.task, "task");
        requireText(request.nonce, "nonce");
        requireText(request.repoUrl, "repo_url");
        requireText(request.commitSha, "commit_sha");
        requireText(request.pagesUrl, "pages_url");
        if (request.round == null || request.round < 1) {
            throw new SubmissionRejectedException(Reason.INVALID, "Field 'round' must be a positive integer");
        }
    }

    private static void requireText(String value, String field) {
        if (TextUtils.isBlank(value)) {
            throw new SubmissionRejectedException(Reason.INVALID, "Missing required field: " + field);
        }
    }
}
