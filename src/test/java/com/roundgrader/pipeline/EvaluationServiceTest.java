package com.roundgrader.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.checks.CheckEngine;
import com.roundgrader.checks.CheckOutcome;
import com.roundgrader.checks.RepositoryCheck;
import com.roundgrader.ledger.Ledger;
import com.roundgrader.models.CheckResult;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EvaluationServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Ledger ledger;
    private CheckEngine engine;
    private RepositoryCheck licenseCheck;
    private RepositoryCheck readmeCheck;
    private EvaluationService service;
    private Submission submission;

    @BeforeEach
    void setUp() throws Exception {
        ledger = Ledger.open("jdbc:sqlite:" + tempDir.resolve("ledger.db"), objectMapper);
        engine = mock(CheckEngine.class);
        licenseCheck = mock(RepositoryCheck.class);
        readmeCheck = mock(RepositoryCheck.class);
        when(readmeCheck.name()).thenReturn("readme_quality");
        service = new EvaluationService(ledger, engine, List.of(licenseCheck));

        Task task = new Task("a@x.com", "calculator-ab12c", 1, "nonce-1");
        task.setBrief("Build a calculator");
        task.setChecks(List.of(
                objectMapper.readTree("{\"type\":\"element_exists\",\"selector\":\"#display\"}"),
                objectMapper.readTree("{\"type\":\"button_exists\",\"text\":\"=\"}")));
        task.setEvaluationUrl("http://collector/api/evaluation");
        task.setEndpoint("http://participant/api/build");
        ledger.insertTask(task);
        submission = new Submission("a@x.com", "calculator-ab12c", 1, "nonce-1",
                "https://github.com/a/calc", "c1", "https://a.github.io/calc/");
        ledger.insertSubmission(submission);

        when(licenseCheck.check(any(Submission.class), any(Task.class)))
                .thenReturn(new CheckOutcome("mit_license", 1.0, "MIT LICENSE file found in root folder", ""));
        when(engine.evaluate(eq("https://a.github.io/calc/"), anyList())).thenReturn(List.of(
                new CheckOutcome("element_#display", 1.0, "Found 1 elements (expected >=1)", "count=1"),
                new CheckOutcome("button_=", 1.0, "Button with text \"=\" found", "")));
    }

    @Test
    void writesLicenseResultFirstThenPageChecks() {
        List<CheckResult> results = service.evaluate(submission, false).orElseThrow();

        assertEquals(List.of("mit_license", "element_#display", "button_="),
                results.stream().map(CheckResult::getCheckName).toList());
        assertEquals(3, ledger.findResults("a@x.com", 1).size());
        assertEquals("c1", ledger.findResults("a@x.com", 1).get(0).getCommitSha());
        verify(engine).evaluate(eq("https://a.github.io/calc/"), argThat(list -> list.size() == 2));
    }

    @Test
    void evaluatedSubmissionIsNotEvaluatedAgain() {
        service.evaluate(submission, false);

        assertTrue(service.evaluate(submission, false).isEmpty());
        assertEquals(3, ledger.findResults("a@x.com", 1).size());
        verify(engine, times(1)).evaluate(anyString(), anyList());
    }

    @Test
    void batchSkipsEvaluatedUnlessForced() {
        assertEquals(new BatchSummary(1, 0, 0, 1), service.evaluatePending(1, false));
        assertEquals(new BatchSummary(0, 0, 0, 0), service.evaluatePending(1, false));

        BatchSummary forced = service.evaluatePending(1, true);

        assertEquals(new BatchSummary(1, 0, 0, 1), forced);
        assertEquals(6, ledger.findResults("a@x.com", 1).size());
    }

    @Test
    void engineCrashCountsAsFailedWithoutResults() {
        when(engine.evaluate(anyString(), anyList())).thenThrow(new IllegalStateException("driver crashed"));

        BatchSummary summary = service.evaluatePending(null, false);

        assertEquals(new BatchSummary(0, 0, 1, 1), summary);
        assertFalse(ledger.resultExists("a@x.com", "calculator-ab12c", 1));
    }

    @Test
    void repositoryChecksAreOptional() {
        EvaluationService withoutLicense = new EvaluationService(ledger, engine, List.of());

        List<CheckResult> results = withoutLicense.evaluate(submission, false).orElseThrow();

        assertEquals(2, results.size());
        verifyNoInteractions(licenseCheck);
    }

    @Test
    void repositoryChecksRunInOrderAndFailuresStayIsolated() {
        when(readmeCheck.check(any(Submission.class), any(Task.class)))
                .thenThrow(new IllegalStateException("unreadable README"));
        EvaluationService withReadme = new EvaluationService(ledger, engine, List.of(licenseCheck, readmeCheck));

        List<CheckResult> results = withReadme.evaluate(submission, false).orElseThrow();

        assertEquals(List.of("mit_license", "readme_quality", "element_#display", "button_="),
                results.stream().map(CheckResult::getCheckName).toList());
        assertEquals(0.0, results.get(1).getScore());
        assertEquals("Error: unreadable README", results.get(1).getReason());
        verify(licenseCheck).check(argThat(s -> s.getNonce().equals("nonce-1")),
                argThat(t -> t.getTaskId().equals("calculator-ab12c")));
    }
}
