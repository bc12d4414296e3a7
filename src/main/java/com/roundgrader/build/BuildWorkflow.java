package com.roundgrader.build;

import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.Deployment;
import com.roundgrader.models.Submission;
import com.roundgrader.notify.NotificationResult;
import com.roundgrader.notify.ResultNotifier;
import com.roundgrader.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Participant-side flow: synthesize code for a task, publish it, remember the deployment and
 * report the published revision to the grading collector.
 */
public class BuildWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(BuildWorkflow.class);

    private final Ledger ledger;
    private final CodeSynthesizer synthesizer;
    private final Publisher publisher;
    private final ResultNotifier notifier;
    private final Clock clock;

    public BuildWorkflow(Ledger ledger, CodeSynthesizer synthesizer, Publisher publisher,
                         ResultNotifier notifier, Clock clock) {
        this.ledger = ledger;
        this.synthesizer = synthesizer;
        this.publisher = publisher;
        this.notifier = notifier;
        this.clock = clock;
    }

    public BuildOutcome build(BuildRequest request) {
        RequestValidator.validate(request);
        String requestId = TextUtils.requestId(request.task, request.round);
        logger.info("[{}] Build requested by {}", requestId, request.email);
        return run(request, Collections.emptyMap(), "Application built and deployed successfully");
    }

    /**
     * @throws DeploymentNotFoundException when no earlier build was recorded for the task
     */
    public BuildOutcome revise(BuildRequest request) {
        RequestValidator.validateRevision(request);
        String requestId = TextUtils.requestId(request.task, request.round);
        Deployment existing = ledger.findDeployment(request.task)
                .orElseThrow(() -> new DeploymentNotFoundException(request.task));
        logger.info("[{}] Revision requested by {} (previous commit {})", requestId, request.email,
                existing.getCommitSha());
        return run(request, existing.getFiles(), "Application revised and redeployed successfully");
    }

    private BuildOutcome run(BuildRequest request, Map<String, String> existingFiles, String successMessage) {
        String requestId = TextUtils.requestId(request.task, request.round);

        Map<String, String> generated = synthesizer.generate(request.brief, request.checks, request.attachments,
                request.task, existingFiles);
        if (generated == null || generated.isEmpty()) {
            logger.error("[{}] Code generation returned no files", requestId);
            return BuildOutcome.failed("Code generation failed", "Code generation returned no files");
        }

        Map<String, String> files = new LinkedHashMap<>(generated);
        files.put(StandardFiles.LICENSE, StandardFiles.mitLicense(Year.now(clock)));
        files.put(StandardFiles.README, StandardFiles.readme(request.task, request.brief, request.checks));
        logger.info("[{}] Publishing {} files", requestId, files.size());

        Publisher.PublishResult published = publisher.publish(files, request.task, request.round);
        if (!published.success()) {
            logger.error("[{}] Deployment failed: {}", requestId, published.error());
            return BuildOutcome.failed("Deployment failed: " + published.error(), published.error());
        }
        logger.info("[{}] Published {} at commit {}", requestId, published.pagesUrl(), published.commitSha());

        Deployment deployment = new Deployment(request.task, request.round, published.repoUrl(),
                published.commitSha(), published.pagesUrl(), files);
        deployment.setUpdatedAt(clock.instant());
        ledger.upsertDeployment(deployment);

        Submission submission = new Submission(request.email, request.task, request.round, request.nonce,
                published.repoUrl(), published.commitSha(), published.pagesUrl());
        NotificationResult notification = notifier.notify(request.evaluationUrl, submission);
        if (!notification.success()) {
            logger.warn("[{}] Deployed but notification failed after {} attempts: {}", requestId,
                    notification.attempts(), notification.error());
        }

        return new BuildOutcome(true, successMessage, published.repoUrl(), published.pagesUrl(),
                published.commitSha(), notification.success(), notification.attempts(), notification.error());
    }
}
