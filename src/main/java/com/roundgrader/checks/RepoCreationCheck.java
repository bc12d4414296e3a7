package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Passes when the repository was created after its task was issued, using the
 * {@code created_at} field of {@code GET {api}/repos/{owner}/{repo}}.
 */
public class RepoCreationCheck implements RepositoryCheck {
    private static final Logger logger = LoggerFactory.getLogger(RepoCreationCheck.class);

    public static final String CHECK_NAME = "repo_creation_time";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;

    public RepoCreationCheck(OkHttpClient httpClient, ObjectMapper objectMapper, String apiBaseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
    }

    @Override
    public String name() {
        return CHECK_NAME;
    }

    @Override
    public CheckOutcome check(Submission submission, Task task) {
        Instant issuedAt = task.getCreatedAt();
        if (issuedAt == null) {
            return CheckOutcome.failed(CHECK_NAME, "Task timestamp unavailable");
        }
        String ownerRepo = RawContentClient.ownerAndRepo(submission.getRepoUrl());
        if (ownerRepo == null) {
            return CheckOutcome.failed(CHECK_NAME, "Cannot derive owner/repo from " + submission.getRepoUrl());
        }
        try {
            Request request = new Request.Builder()
                    .url(apiBaseUrl + "/repos/" + ownerRepo)
                    .header("Accept", "application/vnd.github+json")
                    .get()
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.code() != 200) {
                    return CheckOutcome.failed(CHECK_NAME, "Failed to fetch repo metadata: HTTP " + response.code());
                }
                ResponseBody body = response.body();
                JsonNode repo = objectMapper.readTree(body != null ? body.string() : "{}");
                String createdText = repo.path("created_at").asText("");
                if (createdText.isEmpty()) {
                    return CheckOutcome.failed(CHECK_NAME, "Repo metadata has no created_at");
                }
                Instant createdAt = Instant.parse(createdText);
                String detail = "(task: " + issuedAt + ", repo: " + createdAt + ")";
                if (createdAt.isAfter(issuedAt)) {
                    return new CheckOutcome(CHECK_NAME, 1.0, "Repo created after task time " + detail, "");
                }
                return CheckOutcome.failed(CHECK_NAME, "Repo created before task time " + detail);
            }
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            logger.error("Error checking repo creation time for {}: {}", submission.getRepoUrl(), e.getMessage());
            return CheckOutcome.failed(CHECK_NAME, "Error: " + e.getMessage());
        }
    }
}
