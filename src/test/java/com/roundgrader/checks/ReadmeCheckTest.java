package com.roundgrader.checks;

import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ReadmeCheckTest {

    private static final String GOOD_README = """
            # Calculator

            ## About
            A small calculator that adds, subtracts, multiplies and divides numbers typed on a keypad.

            ## Setup
            Open index.html in any modern browser. No build step is needed.

            ## License
            Released under the MIT License.
            """;

    private MockWebServer server;
    private ReadmeCheck check;
    private final Submission submission = new Submission("a@x.com", "calculator-ab12c", 1, "n1",
            "https://github.com/alice/calc", "abc123", "https://alice.github.io/calc/");
    private final Task task = new Task("a@x.com", "calculator-ab12c", 1, "n1");

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        check = new ReadmeCheck(new RawContentClient(new OkHttpClient(), server.url("/raw/").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void completeReadmeScoresFull() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(GOOD_README));

        CheckOutcome outcome = check.check(submission, task);

        assertEquals("readme_quality", outcome.name());
        assertEquals(1.0, outcome.score());
        assertEquals("/raw/alice/calc/abc123/README.md", server.takeRequest().getPath());
        assertTrue(outcome.logs().startsWith("# Calculator"));
    }

    @Test
    void eachMissingHeuristicCostsOneFifth() {
        CheckOutcome outcome = ReadmeCheck.score("# Calc\nInstall by opening the page.");

        assertEquals(0.4, outcome.score(), 1e-9);
        assertEquals("✗ Too short; ✓ Contains headings; ✓ Has setup/usage section; ✗ No description; "
                + "✗ No license mention", outcome.reason());
    }

    @Test
    void missingReadmeFails() {
        server.enqueue(new MockResponse().setResponseCode(404));

        CheckOutcome outcome = check.check(submission, task);

        assertEquals(0.0, outcome.score());
        assertEquals("README.md not found: HTTP 404", outcome.reason());
    }
}
