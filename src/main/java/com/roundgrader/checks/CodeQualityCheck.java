package com.roundgrader.checks;

import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores the front-end sources at the submitted revision on five heuristics worth 0.2 each.
 * Missing files are tolerated as long as at least one of them exists.
 */
public class CodeQualityCheck implements RepositoryCheck {
    private static final Logger logger = LoggerFactory.getLogger(CodeQualityCheck.class);

    public static final String CHECK_NAME = "code_quality";
    static final List<String> FILES = List.of("index.html", "script.js", "style.css");

    private static final Pattern DECLARATIONS = Pattern.compile("\\b(function|const|let)\\b");
    private static final Pattern INTERACTIVITY = Pattern.compile("addEventListener|onclick|querySelector");
    private static final Pattern COMMENTS = Pattern.compile("/\\*|<!--|(?m)^\\s*//");

    private final RawContentClient rawContent;

    public CodeQualityCheck(RawContentClient rawContent) {
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
            List<String> sources = new ArrayList<>();
            for (String file : FILES) {
                RawContentClient.RawFile source = rawContent.fetch(ownerRepo, submission.getCommitSha(), file);
                if (source.found()) {
                    sources.add(source.content());
                } else {
                    logger.debug("{} missing at {} ({}): HTTP {}", file, ownerRepo, submission.getCommitSha(),
                            source.statusCode());
                }
            }
            if (sources.isEmpty()) {
                return CheckOutcome.failed(CHECK_NAME, "No code files found");
            }
            return score(String.join("\n\n", sources));
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Error evaluating code quality for {}: {}", submission.getRepoUrl(), e.getMessage());
            return CheckOutcome.failed(CHECK_NAME, "Error: " + e.getMessage());
        }
    }

    static CheckOutcome score(String code) {
        List<String> reasons = new ArrayList<>();
        if (code.length() > 100) {
            reasons.add("✓ Non-trivial code length");
        }
        if (DECLARATIONS.matcher(code).find()) {
            reasons.add("✓ Contains functions/variables");
        }
        if (INTERACTIVITY.matcher(code).find()) {
            reasons.add("✓ Has interactivity");
        }
        if (code.toLowerCase(Locale.ROOT).contains("style") || code.contains(".css")) {
            reasons.add("✓ Has styling");
        }
        if (COMMENTS.matcher(code).find()) {
            reasons.add("✓ Contains comments");
        }
        String reason = reasons.isEmpty() ? "No quality signals found" : String.join("; ", reasons);
        return new CheckOutcome(CHECK_NAME, reasons.size() / 5.0, reason, code);
    }
}
