package com.roundgrader.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.models.Task;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Delivers a task to the participant's endpoint with a bounded number of attempts separated by a
 * fixed escalating delay schedule. Only HTTP 200 counts as delivered. Transport failures are
 * reported in the returned outcome, never thrown.
 */
public class TaskDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(TaskDispatcher.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;
    private final List<Duration> retryDelays;
    private final Sleeper sleeper;

    public TaskDispatcher(OkHttpClient httpClient, ObjectMapper objectMapper, int maxAttempts,
                          List<Duration> retryDelays, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (retryDelays.size() < maxAttempts - 1) {
            throw new IllegalArgumentException("Need a retry delay between every two attempts");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.maxAttempts = maxAttempts;
        this.retryDelays = List.copyOf(retryDelays);
        this.sleeper = sleeper;
    }

    public static TaskDispatcher fromSettings(PipelineSettings settings, ObjectMapper objectMapper, Sleeper sleeper) {
        long timeoutMillis = settings.getDispatchTimeout().toMillis();
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
        return new TaskDispatcher(client, objectMapper, settings.getDispatchMaxAttempts(),
                settings.getDispatchRetryDelays(), sleeper);
    }

    /**
     * The exact body sent to the participant.
     */
    public Map<String, Object> payload(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", task.getEmail());
        payload.put("task", task.getTaskId());
        payload.put("round", task.getRound());
        payload.put("nonce", task.getNonce());
        payload.put("brief", task.getBrief());
        payload.put("attachments", task.getAttachments());
        payload.put("checks", task.getChecks());
        payload.put("evaluation_url", task.getEvaluationUrl());
        payload.put("secret", task.getSecret());
        return payload;
    }

    public DispatchOutcome dispatch(Task task) {
        String requestId = TextUtils.requestId(task.getTaskId(), task.getRound());
        String body;
        try {
            body = objectMapper.writeValueAsString(payload(task));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize task " + requestId, e);
        }

        int statusCode = 0;
        String error = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            logger.info("[{}] Sending task to {} (attempt {}/{})", requestId, task.getEndpoint(), attempt + 1, maxAttempts);
            try (Response response = httpClient.newCall(buildRequest(task.getEndpoint(), body)).execute()) {
                statusCode = response.code();
                if (statusCode == 200) {
                    logger.info("[{}] Participant endpoint accepted the task", requestId);
                    return DispatchOutcome.delivered(attempt + 1);
                }
                ResponseBody responseBody = response.body();
                String text = responseBody != null ? responseBody.string() : "";
                error = "HTTP " + statusCode + ": " + TextUtils.truncate(text, 200);
                logger.warn("[{}] Participant endpoint error: {}", requestId, error);
            } catch (InterruptedIOException e) {
                statusCode = 0;
                error = "Timeout: " + e.getMessage();
                logger.error("[{}] {}", requestId, error);
            } catch (IOException | IllegalArgumentException e) {
                statusCode = 0;
                error = "Request error: " + e.getMessage();
                logger.error("[{}] {}", requestId, error);
            }

            if (attempt < maxAttempts - 1) {
                Duration delay = retryDelays.get(attempt);
                logger.info("[{}] Retrying in {} seconds...", requestId, delay.toSeconds());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return DispatchOutcome.failed(statusCode, attempt + 1, "Interrupted while waiting to retry");
                }
            }
        }
        logger.error("[{}] Giving up after {} attempts: {}", requestId, maxAttempts, error);
        return DispatchOutcome.failed(statusCode, maxAttempts, error);
    }

    private static Request buildRequest(String url, String body) {
        return new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();
    }
}
