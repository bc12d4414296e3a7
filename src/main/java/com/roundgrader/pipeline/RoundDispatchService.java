package com.roundgrader.pipeline;

import com.roundgrader.dispatch.DispatchOutcome;
import com.roundgrader.dispatch.TaskDispatcher;
import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.CheckResult;
import com.roundgrader.models.GeneratedTask;
import com.roundgrader.models.Participant;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import com.roundgrader.tasks.TaskGenerator;
import com.roundgrader.tasks.TemplateNotFoundException;
import com.roundgrader.utils.Sleeper;
import com.roundgrader.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Generates and dispatches tasks to participants, one participant at a time.
 * A failure for one participant is counted and logged, then the batch moves on.
 */
public class RoundDispatchService {
    private static final Logger logger = LoggerFactory.getLogger(RoundDispatchService.class);

    private final Ledger ledger;
    private final TaskGenerator generator;
    private final TaskDispatcher dispatcher;
    private final String evaluationUrl;
    private final Set<String> criticalChecks;
    private final Sleeper sleeper;
    private final Duration pause;
    private final Supplier<String> nonces;

    public RoundDispatchService(Ledger ledger, TaskGenerator generator, TaskDispatcher dispatcher,
                                String evaluationUrl, List<String> criticalChecks, Sleeper sleeper,
                                Duration pause) {
        this(ledger, generator, dispatcher, evaluationUrl, criticalChecks, sleeper, pause,
                () -> UUID.randomUUID().toString());
    }

    RoundDispatchService(Ledger ledger, TaskGenerator generator, TaskDispatcher dispatcher,
                         String evaluationUrl, List<String> criticalChecks, Sleeper sleeper,
                         Duration pause, Supplier<String> nonces) {
        this.ledger = ledger;
        this.generator = generator;
        this.dispatcher = dispatcher;
        this.evaluationUrl = evaluationUrl;
        this.criticalChecks = Set.copyOf(criticalChecks);
        this.sleeper = sleeper;
        this.pause = pause;
        this.nonces = nonces;
    }

    public BatchSummary runRoundOne(List<Participant> participants) throws InterruptedException {
        logger.info("Starting round 1 for {} participants", participants.size());
        BatchSummary.Counter counter = new BatchSummary.Counter();
        for (Participant participant : participants) {
            try {
                if (dispatchRoundOne(participant)) {
                    counter.processed();
                    pause();
                } else {
                    counter.skipped();
                }
            } catch (RuntimeException e) {
                logger.error("Round 1 failed for {}", participant.email(), e);
                counter.failed();
            }
        }
        BatchSummary summary = counter.summary();
        logger.info("Round 1 complete: {}", summary);
        return summary;
    }

    private boolean dispatchRoundOne(Participant participant) {
        String hourBucket = generator.currentHourBucket();
        GeneratedTask generated = generator.generateRoundOne(participant.email(), hourBucket);
        String requestId = TextUtils.requestId(generated.taskId(), 1);
        if (ledger.taskExists(participant.email(), generated.taskId(), 1)) {
            logger.info("[{}] Task already dispatched to {}, skipping", requestId, participant.email());
            return false;
        }
        logger.info("[{}] Generated {} for {}", requestId, generated.templateId(), participant.email());
        Task task = newTask(participant.email(), generated, participant.endpoint(), participant.secret());
        dispatchAndRecord(task);
        return true;
    }

    public BatchSummary runRoundTwo() throws InterruptedException {
        List<Submission> roundOne = ledger.findSubmissions(1);
        logger.info("Starting round 2 over {} round 1 submissions", roundOne.size());
        BatchSummary.Counter counter = new BatchSummary.Counter();
        for (Submission submission : roundOne) {
            try {
                if (dispatchRoundTwo(submission)) {
                    counter.processed();
                    pause();
                } else {
                    counter.skipped();
                }
            } catch (TemplateNotFoundException e) {
                logger.error("Cannot recover template for {} from task {}: {}", submission.getEmail(),
                        submission.getTaskId(), e.getMessage());
                counter.failed();
            } catch (RuntimeException e) {
                logger.error("Round 2 failed for {}", submission.getEmail(), e);
                counter.failed();
            }
        }
        BatchSummary summary = counter.summary();
        logger.info("Round 2 complete: {}", summary);
        return summary;
    }

    private boolean dispatchRoundTwo(Submission submission) {
        String email = submission.getEmail();
        String templateId = TaskGenerator.templateIdOf(submission.getTaskId());

        boolean alreadyAssigned = ledger.findTasks(email, 2).stream()
                .anyMatch(t -> templateId.equals(t.getTemplateId()));
        if (alreadyAssigned) {
            logger.info("Round 2 task for {} ({}) already exists, skipping", email, templateId);
            return false;
        }
        if (!eligibleForRoundTwo(email)) {
            return false;
        }

        Optional<Task> roundOneTask = ledger.findTaskByNonce(submission.getNonce());
        if (roundOneTask.isEmpty()) {
            logger.warn("No round 1 task for nonce {} ({}), skipping", submission.getNonce(), email);
            return false;
        }

        GeneratedTask generated = generator.generateFollowUp(2, email, generator.currentHourBucket(),
                submission.getTaskId());
        if (ledger.submissionExists(email, generated.taskId(), 2) || ledger.taskExists(email, generated.taskId(), 2)) {
            logger.info("[{}] Round 2 already handled for {}, skipping",
                    TextUtils.requestId(generated.taskId(), 2), email);
            return false;
        }
        Task previous = roundOneTask.get();
        Task task = newTask(email, generated, previous.getEndpoint(), previous.getSecret());
        dispatchAndRecord(task);
        return true;
    }

    /**
     * A participant moves on unless one of the critical round 1 checks scored zero.
     * Participants without any round 1 results are let through with a warning.
     */
    boolean eligibleForRoundTwo(String email) {
        List<CheckResult> results = ledger.findResults(email, 1);
        if (results.isEmpty()) {
            logger.warn("No round 1 results for {}; proceeding to round 2 anyway", email);
            return true;
        }
        for (CheckResult result : results) {
            if (criticalChecks.contains(result.getCheckName()) && result.getScore() == 0.0) {
                logger.info("{} failed critical check {}, not eligible for round 2", email, result.getCheckName());
                return false;
            }
        }
        return true;
    }

    private Task newTask(String email, GeneratedTask generated, String endpoint, String secret) {
        Task task = new Task(email, generated.taskId(), generated.round(), nonces.get());
        task.setBrief(generated.brief());
        task.setAttachments(generated.attachments());
        task.setChecks(generated.checks());
        task.setEvaluationUrl(evaluationUrl);
        task.setEndpoint(endpoint);
        task.setSecret(secret);
        return task;
    }

    private void dispatchAndRecord(Task task) {
        DispatchOutcome outcome = dispatcher.dispatch(task);
        task.setStatusCode(outcome.statusCode());
        task.setError(outcome.error());
        ledger.insertTask(task);
        String requestId = TextUtils.requestId(task.getTaskId(), task.getRound());
        if (outcome.delivered()) {
            logger.info("[{}] Delivered to {} after {} attempt(s)", requestId, task.getEmail(), outcome.attempts());
        } else {
            logger.warn("[{}] Delivery to {} failed after {} attempt(s): {}", requestId, task.getEmail(),
                    outcome.attempts(), outcome.error());
        }
    }

    private void pause() throws InterruptedException {
        if (!pause.isZero()) {
            sleeper.sleep(pause);
        }
    }
}
