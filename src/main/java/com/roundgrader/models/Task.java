package com.roundgrader.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A dispatched assignment: generated content plus the delivery outcome.
 * Check descriptors are kept in their wire form so the exact payload can be re-sent.
 */
public class Task {
    private String email;
    private String taskId;
    private int round;
    private String nonce;
    private String brief;
    private List<JsonNode> checks = new ArrayList<>();
    private List<Attachment> attachments = new ArrayList<>();
    private String evaluationUrl;
    private String endpoint;
    private String secret;
    private Integer statusCode;
    private String error;
    private Instant createdAt;

    public Task() {
        this.createdAt = Instant.now();
    }

    public Task(String email, String taskId, int round, String nonce) {
        this();
        this.email = email;
        this.taskId = taskId;
        this.round = round;
        this.nonce = nonce;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public int getRound() {
        return round;
    }

    public void setRound(int round) {
        this.round = round;
    }

    public String getNonce() {
        return nonce;
    }

    public void setNonce(String nonce) {
        this.nonce = nonce;
    }

    public String getBrief() {
        return brief;
    }

    public void setBrief(String brief) {
        this.brief = brief;
    }

    public List<JsonNode> getChecks() {
        return checks;
    }

    public void setChecks(List<JsonNode> checks) {
        this.checks = checks;
    }

    public List<Attachment> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<Attachment> attachments) {
        this.attachments = attachments;
    }

    public String getEvaluationUrl() {
        return evaluationUrl;
    }

    public void setEvaluationUrl(String evaluationUrl) {
        this.evaluationUrl = evaluationUrl;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    /**
     * Last HTTP status seen while dispatching; 0 for a transport failure, null if never sent.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(Integer statusCode) {
        this.statusCode = statusCode;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isDelivered() {
        return statusCode != null && statusCode == 200;
    }

    /**
     * Template id recovered from a task id of the form {@code {templateId}-{hash}}.
     */
    public String getTemplateId() {
        int idx = taskId != null ? taskId.lastIndexOf('-') : -1;
        return idx > 0 ? taskId.substring(0, idx) : null;
    }

    @Override
    public String toString() {
        return "Task{" +
                "email='" + email + '\'' +
                ", taskId='" + taskId + '\'' +
                ", round=" + round +
                ", checks=" + (checks != null ? checks.size() : 0) +
                ", attachments=" + (attachments != null ? attachments.size() : 0) +
                ", statusCode=" + statusCode +
                ", error='" + error + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
