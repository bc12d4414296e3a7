package com.roundgrader.models;

import java.time.Instant;

/**
 * The scored outcome of one check against one submission.
 */
public class CheckResult {
    private String email;
    private String taskId;
    private int round;
    private String repoUrl;
    private String commitSha;
    private String pagesUrl;
    private String checkName;
    private double score;
    private String reason;
    private String logs;
    private Instant createdAt;

    public CheckResult() {
        this.createdAt = Instant.now();
    }

    /**
     * Build a result row for the given submission, copying its identity and linkage fields.
     */
    public static CheckResult forSubmission(Submission submission, String checkName,
                                            double score, String reason, String logs) {
        CheckResult result = new CheckResult();
        result.setEmail(submission.getEmail());
        result.setTaskId(submission.getTaskId());
        result.setRound(submission.getRound());
        result.setRepoUrl(submission.getRepoUrl());
        result.setCommitSha(submission.getCommitSha());
        result.setPagesUrl(submission.getPagesUrl());
        result.setCheckName(checkName);
        result.setScore(score);
        result.setReason(reason);
        result.setLogs(logs);
        return result;
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

    public String getCheckName() {
        return checkName;
    }

    public void setCheckName(String checkName) {
        this.checkName = checkName;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getLogs() {
        return logs;
    }

    public void setLogs(String logs) {
        this.logs = logs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isPassed() {
        return score >= 1.0;
    }

    @Override
    public String toString() {
        return "CheckResult{" +
                "email='" + email + '\'' +
                ", taskId='" + taskId + '\'' +
                ", round=" + round +
                ", checkName='" + checkName + '\'' +
                ", score=" + score +
                ", reason='" + reason + '\'' +
                '}';
    }
}
