package com.roundgrader.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionIngestorTest {

    @TempDir
    Path tempDir;

    private Ledger ledger;
    private SubmissionIngestor ingestor;

    @BeforeEach
    void setUp() {
        ledger = Ledger.open("jdbc:sqlite:" + tempDir.resolve("ledger.db"), new ObjectMapper());
        Task task = new Task("a@x.com", "calculator-ab12c", 1, "nonce-1");
        task.setBrief("Build a calculator");
        task.setEvaluationUrl("http://collector/api/evaluation");
        task.setEndpoint("http://participant/api/build");
        task.setStatusCode(200);
        ledger.insertTask(task);
        ingestor = new SubmissionIngestor(ledger);
    }

    private SubmissionRequest request(String email, String task, int round, String nonce) {
        return new SubmissionRequest(email, task, round, nonce,
                "https://github.com/a/calc", "abc123", "https://a.github.io/calc/");
    }

    private SubmissionRejectedException rejected(SubmissionRequest request) {
        return assertThrows(SubmissionRejectedException.class, () -> ingestor.ingest(request));
    }

    @Test
    void storesMatchingSubmission() {
        Submission stored = ingestor.ingest(request("a@x.com", "calculator-ab12c", 1, "nonce-1"));

        assertEquals("abc123", stored.getCommitSha());
        assertTrue(ledger.submissionExists("a@x.com", "calculator-ab12c", 1));
    }

    @Test
    void unknownNonceIsRejected() {
        SubmissionRejectedException e = rejected(request("a@x.com", "calculator-ab12c", 1, "forged"));

        assertEquals(SubmissionRejectedException.Reason.NONCE_NOT_FOUND, e.getReason());
        assertEquals("Invalid nonce. Task not found.", e.getMessage());
    }

    @Test
    void identityMismatchIsRejectedAndNotStored() {
        SubmissionRejectedException email = rejected(request("b@x.com", "calculator-ab12c", 1, "nonce-1"));
        SubmissionRejectedException task = rejected(request("a@x.com", "calculator-zzzzz", 1, "nonce-1"));
        SubmissionRejectedException round = rejected(request("a@x.com", "calculator-ab12c", 2, "nonce-1"));

        assertEquals("Email does not match the task record.", email.getMessage());
        assertEquals("Task ID does not match the task record.", task.getMessage());
        assertEquals("Round number does not match the task record.", round.getMessage());
        assertEquals(SubmissionRejectedException.Reason.IDENTITY_MISMATCH, round.getReason());
        assertTrue(ledger.findSubmissions(null).isEmpty());
    }

    @Test
    void secondSubmissionIsDuplicate() {
        ingestor.ingest(request("a@x.com", "calculator-ab12c", 1, "nonce-1"));

        SubmissionRejectedException e = rejected(request("a@x.com", "calculator-ab12c", 1, "nonce-1"));

        assertEquals(SubmissionRejectedException.Reason.DUPLICATE, e.getReason());
        assertEquals(1, ledger.findSubmissions(1).size());
    }

    @Test
    void missingFieldsAreInvalid() {
        SubmissionRequest request = request("a@x.com", "calculator-ab12c", 1, "nonce-1");
        request.pagesUrl = " ";

        SubmissionRejectedException e = rejected(request);

        assertEquals(SubmissionRejectedException.Reason.INVALID, e.getReason());
        assertEquals("Missing required field: pages_url", e.getMessage());
        request.pagesUrl = "https://a.github.io/calc/";
        request.round = null;
        assertEquals(SubmissionRejectedException.Reason.INVALID, rejected(request).getReason());
    }
}
