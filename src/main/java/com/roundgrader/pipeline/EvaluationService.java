package com.roundgrader.pipeline;

import com.roundgrader.checks.CheckEngine;
import com.roundgrader.checks.CheckOutcome;
import com.roundgrader.checks.RepositoryCheck;
import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import com.roundgrader.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Grades stored submissions against the checks of the task they answer and writes one result
 * row per check. A submission that already has results is left alone unless forced.
 */
public class EvaluationService {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationService.class);

    private final Ledger ledger;
    private final CheckEngine engine;
    private final List<RepositoryCheck> repositoryChecks;

    /**
     * @param repositoryChecks checks against the submitted repository, run in order before the page checks
     */
    public EvaluationService(Ledger ledger, CheckEngine engine, List<RepositoryCheck> repositoryChecks) {
        this.ledger = ledger;
        this.engine = engine;
        this.repositoryChecks = List.copyOf(repositoryChecks);
    }

    public BatchSummary evaluatePending(Integer round, boolean force) {
        List<Submission> submissions = force
                ? ledger.findSubmissions(round)
                : ledger.findSubmissionsWithoutResults(round);
        logger.info("Evaluating {} submissions (round={}, force={})", submissions.size(),
                round == null ? "all" : round, force);

        BatchSummary.Counter counter = new BatchSummary.Counter();
        for (Submission submission : submissions) {
            try {
                if (evaluate(submission, force).isPresent()) {
                    counter.processed();
                } else {
                    counter.skipped();
                }
            } catch (RuntimeException e) {
                logger.error("Evaluation failed for {} ({})", submission.getEmail(), submission.getTaskId(), e);
                counter.failed();
            }
        }
        BatchSummary summary = counter.summary();
        logger.info("Evaluation complete: {}", summary);
        return summary;
    }

    /**
     * @return the stored results, or empty when the submission was already evaluated and not forced
     * @throws IllegalStateException when the submission's nonce no longer resolves to a task
     */
    public Optional<List<CheckResult>> evaluate(Submission submission, boolean force) {
        String requestId = TextUtils.requestId(submission.getTaskId(), submission.getRound());
        if (!force && ledger.resultExists(submission.getEmail(), submission.getTaskId(), submission.getRound())) {
            logger.info("[{}] Already evaluated for {}, skipping", requestId, submission.getEmail());
            return Optional.empty();
        }
        Task task = ledger.findTaskByNonce(submission.getNonce())
                .orElseThrow(() -> new IllegalStateException("No task for nonce " + submission.getNonce()));

        logger.info("[{}] Evaluating {} at {}", requestId, submission.getEmail(), submission.getPagesUrl());
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (RepositoryCheck check : repositoryChecks) {
            outcomes.add(runIsolated(check, submission, task));
        }
        outcomes.addAll(engine.evaluate(submission.getPagesUrl(), task.getChecks()));

        List<CheckResult> results = new ArrayList<>(outcomes.size());
        for (CheckOutcome outcome : outcomes) {
            results.add(CheckResult.forSubmission(submission, outcome.name(), outcome.score(),
                    outcome.reason(), outcome.logs()));
        }
        int written = ledger.insertResults(results);
        double total = outcomes.stream().mapToDouble(CheckOutcome::score).sum();
        logger.info("[{}] Stored {} results, total score {}/{}", requestId, written,
                String.format(Locale.ROOT, "%.2f", total), outcomes.size());
        return Optional.of(results);
    }

    private CheckOutcome runIsolated(RepositoryCheck check, Submission submission, Task task) {
        try {
            return check.check(submission, task);
        } catch (RuntimeException e) {
            logger.error("Error in repository check {} for {}: {}", check.name(), submission.getEmail(), e.getMessage());
            return CheckOutcome.failed(check.name(), "Error: " + e.getMessage());
        }
    }
}
