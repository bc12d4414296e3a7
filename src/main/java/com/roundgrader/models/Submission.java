package com.roundgrader.models;

import java.time.Instant;

/**
 * A participant's claim that a task was fulfilled: where the code lives, the revision
 * and the public page to grade.
 */
public class Submission {
    private String email;
    private String taskId;
    private int round;
    private String nonce;
    private String repoUrl;
    private String commitSha;
    private String pagesUrl;
    private Instant receivedAt;

    public Submission() {}

    public Submission(String email, String taskId, int round, String nonce,
                      String repoUrl, String commitSha, String pagesUrl) {
        this.email = email;
        this.taskId = taskId;
        this.round = round;
        this.nonce = nonce;
        this.repoUrl = repoUrl;
        this.commitSha = commitSha;
        this.pagesUrl = pagesUrl;
        this.receivedAt = Instant.now();
    }

    // Getters and Setters
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

    public String getRepoUrl() {
        return repoUrl;
    }

    public void setRepoUrl(String repoUrl) {
        this.repoUrl = repoUrl;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public void setCommitSha(String commitSha) {
        this.commitSha = commitSha;
    }

    public String getPagesUrl() {
        return pagesUrl;
    }

    public void setPagesUrl(String pagesUrl) {
        this.pagesUrl = pagesUrl;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(Instant receivedAt) {
        this.receivedAt = receivedAt;
    }

    @Override
    public String toString() {
        return "Submission{" +
                "email='" + email + '\'' +
                ", taskId='" + taskId + '\'' +
                ", round=" + round +
                ", repoUrl='" + repoUrl + '\'' +
                ", commitSha='" + commitSha + '\'' +
                ", pagesUrl='" + pagesUrl + '\'' +
                ", receivedAt=" + receivedAt +
                '}';
    }
}
