package com.roundgrader.models;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest published state of a task built by the build workflow. Read back when a revision
 * request arrives so any process can resume from it.
 */
public class Deployment {
    private String taskId;
    private int round;
    private String repoUrl;
    private String commitSha;
    private String pagesUrl;
    private Map<String, String> files = new LinkedHashMap<>();
    private Instant updatedAt;

    public Deployment() {
        this.updatedAt = Instant.now();
    }

    public Deployment(String taskId, int round, String repoUrl, String commitSha, String pagesUrl,
                      Map<String, String> files) {
        this();
        this.taskId = taskId;
        this.round = round;
        this.repoUrl = repoUrl;
        this.commitSha = commitSha;
        this.pagesUrl = pagesUrl;
        this.files = new LinkedHashMap<>(files);
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

    public Map<String, String> getFiles() {
        return files;
    }

    public void setFiles(Map<String, String> files) {
        this.files = files;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Deployment{" +
                "taskId='" + taskId + '\'' +
                ", round=" + round +
                ", repoUrl='" + repoUrl + '\'' +
                ", commitSha='" + commitSha + '\'' +
                ", files=" + (files != null ? files.keySet() : "[]") +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
