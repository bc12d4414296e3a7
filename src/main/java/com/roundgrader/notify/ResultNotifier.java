package com.roundgrader.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Submission;
import com.roundgrader.utils.PipelineSettings;
import com.roundgrader.utils.Sleeper;
import com.roundgrader.utils.TextUtils;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Posts submission metadata to a grading collector, retrying with exponential backoff
 * (base, 2x base, 4x base, ...) until HTTP 200 or the retry budget is spent.
 */
public class ResultNotifier {
    private static final Logger logger = LoggerFactory.getLogger(ResultNotifier.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public ResultNotifier(OkHttpClient httpClient, ObjectMapper objectMapper, int maxRetries,
                          Duration baseDelay, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public static ResultNotifier fromSettings(PipelineSettings settings, ObjectMapper objectMapper, Sleeper sleeper) {
        long timeoutMillis = settings.getNotifierTimeout().toMillis();
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
        return new ResultNotifier(client, objectMapper, settings.getNotifierMaxRetries(),
                settings.getNotifierBaseDelay(), sleeper);
    }

    public Map<String, Object> payload(Submission submission) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", submission.getEmail());
        payload.put("task", submission.getTaskId());
        payload.put("round", submission.getRound());
        payload.put("nonce", submission.getNonce());
        payload.put("repo_url", submission.getRepoUrl());
        payload.put("commit_sha", submission.getCommitSha());
        payload.put("pages_url", submission.getPagesUrl());
        return payload;
    }

    public NotificationResult notify(String evaluationUrl, Submission submission) {
        String requestId = TextUtils.requestId(submission.getTaskId(), submission.getRound());
        logger.info("[{}] Sending notification to: {}", requestId, evaluationUrl);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload(submission));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize notification " + requestId, e);
        }

        int totalAttempts = maxRetries + 1;
        int statusCode = 0;
        String error = null;
        for (int attempt = 0; attempt < totalAttempts; attempt++) {
            logger.info("[{}] Attempt {}/{}", requestId, attempt + 1, totalAttempts);
            try (Response response = httpClient.newCall(buildRequest(evaluationUrl, body)).execute()) {
                statusCode = response.code();
                ResponseBody responseBody = response.body();
                String text = responseBody != null ? responseBody.string() : "";
                if (statusCode == 200) {
                    logger.info("[{}] Notification sent successfully: HTTP 200", requestId);
                    return new NotificationResult(true, 200, attempt + 1, null, TextUtils.truncate(text, 200));
                }
                error = "HTTP " + statusCode + ": " + TextUtils.truncate(text, 200);
                logger.warn("[{}] Received HTTP {}, will retry", requestId, statusCode);
            } catch (InterruptedIOException e) {
                statusCode = 0;
                error = "Request timed out";
                logger.warn("[{}] Request timed out", requestId);
            } catch (IOException | IllegalArgumentException e) {
                statusCode = 0;
                error = TextUtils.truncate("Connection error: " + e.getMessage(), 200);
                logger.warn("[{}] {}", requestId, error);
            }

            if (attempt < totalAttempts - 1) {
                Duration delay = baseDelay.multipliedBy(1L << attempt);
                logger.info("[{}] Retrying in {} ms...", requestId, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new NotificationResult(false, statusCode, attempt + 1,
                            "Interrupted while waiting to retry", null);
                }
            }
        }
        logger.error("[{}] Max retries reached, giving up: {}", requestId, error);
        return new NotificationResult(false, statusCode, totalAttempts, error, null);
    }

    private static Request buildRequest(String url, String body) {
        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();
    }
}
