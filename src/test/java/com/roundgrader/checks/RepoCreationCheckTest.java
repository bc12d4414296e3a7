package com.roundgrader.checks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RepoCreationCheckTest {

    private MockWebServer server;
    private RepoCreationCheck check;
    private final Submission submission = new Submission("a@x.com", "calculator-ab12c", 1, "n1",
            "https://github.com/alice/calc", "abc123", "https://alice.github.io/calc/");
    private Task task;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        check = new RepoCreationCheck(new OkHttpClient(), new ObjectMapper(), server.url("/").toString());
        task = new Task("a@x.com", "calculator-ab12c", 1, "n1");
        task.setCreatedAt(Instant.parse("2025-10-16T14:05:00Z"));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void repoCreatedAfterTaskPasses() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"name\":\"calc\",\"created_at\":\"2025-10-16T15:30:00Z\"}"));

        CheckOutcome outcome = check.check(submission, task);

        assertEquals("repo_creation_time", outcome.name());
        assertEquals(1.0, outcome.score());
        RecordedRequest request = server.takeRequest();
        assertEquals("/repos/alice/calc", request.getPath());
    }

    @Test
    void repoCreatedBeforeTaskFails() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"created_at\":\"2025-09-01T08:00:00Z\"}"));

        CheckOutcome outcome = check.check(submission, task);

        assertEquals(0.0, outcome.score());
        assertTrue(outcome.reason().startsWith("Repo created before task time"));
    }

    @Test
    void metadataErrorsScoreZero() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"created_at\":\"yesterday\"}"));

        assertEquals("Failed to fetch repo metadata: HTTP 404", check.check(submission, task).reason());
        CheckOutcome unparseable = check.check(submission, task);
        assertEquals(0.0, unparseable.score());
        assertTrue(unparseable.reason().startsWith("Error:"));
    }
}
