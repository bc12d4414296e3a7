package com.roundgrader.checks;

import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores README.md at the submitted revision on five heuristics worth 0.2 each.
 */
public class ReadmeCheck implements RepositoryCheck {
    private static final Logger logger = LoggerFactory.getLogger(ReadmeCheck.class);

    public static final String CHECK_NAME = "readme_quality";
    static final int MIN_LENGTH = 200;

    private final RawContentClient rawContent;

    public ReadmeCheck(RawContentClient rawContent) {
        this.rawContent = rawContent;
    }

    @Override
    public String name() {
        return CHECK_NAME;
    }

    @Override
    public CheckOutcome check(Submission submission, Task task) {
        String ownerRepo = RawContentClient.ownerAndRepo(submission.getRepoUrl());
        if (ownerRepo == null) {
            return CheckOutcome.failed(CHECK_NAME, "Cannot derive owner/repo from " + submission.getRepoUrl());
        }
        try {
            RawContentClient.RawFile readme = rawContent.fetch(ownerRepo, submission.getCommitSha(), "README.md");
            if (!readme.found()) {
                return CheckOutcome.failed(CHECK_NAME, "README.md not found: HTTP " + readme.statusCode());
            }
            return score(readme.content());
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Error evaluating README for {}: {}", submission.getRepoUrl(), e.getMessage());
            return CheckOutcome.failed(CHECK_NAME, "Error: " + e.getMessage());
        }
    }

    static CheckOutcome score(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        List<String> reasons = new ArrayList<>();
        int passed = 0;
        passed += mark(reasons, content.length() > MIN_LENGTH, "Sufficient length (>200 chars)", "Too short");
        passed += mark(reasons, lower.contains("# "), "Contains headings", "No headings");
        passed += mark(reasons, containsAny(lower, "usage", "setup", "install"),
                "Has setup/usage section", "Missing setup/usage");
        passed += mark(reasons, containsAny(lower, "description", "about", "summary"),
                "Has description", "No description");
        passed += mark(reasons, lower.contains("license"), "Mentions license", "No license mention");
        return new CheckOutcome(CHECK_NAME, passed / 5.0, String.join("; ", reasons), content);
    }

    private static int mark(List<String> reasons, boolean ok, String pass, String fail) {
        reasons.add(ok ? "✓ " + pass : "✗ " + fail);
        return ok ? 1 : 0;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
