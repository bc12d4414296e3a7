package com.roundgrader.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/evaluation}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmissionRequest {
    public String email;
    public String task;
    public Integer round;
    public String nonce;
    @JsonProperty("repo_url")
    public String repoUrl;
    @JsonProperty("commit_sha")
    public String commitSha;
    @JsonProperty("pages_url")
    public String pagesUrl;

    public SubmissionRequest() {}

    public SubmissionRequest(String email, String task, Integer round, String nonce,
                             String repoUrl, String commitSha, String pagesUrl) {
        this.email = email;
        this.task = task;
        this.round = round;
        this.nonce = nonce;
        this.repoUrl = repoUrl;
        this.commitSha = commitSha;
        this.pagesUrl = pagesUrl;
    }
}
