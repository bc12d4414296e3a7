package com.roundgrader.build;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.roundgrader.models.Attachment;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/build} and {@code POST /api/revise}: the task a participant
 * server received and must turn into a published application.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuildRequest {
    public String email;
    public String secret;
    public String task;
    public Integer round;
    public String nonce;
    public String brief;
    public List<JsonNode> checks = new ArrayList<>();
    @JsonProperty("evaluation_url")
    public String evaluationUrl;
    public List<Attachment> attachments = new ArrayList<>();

    public BuildRequest() {}

    public BuildRequest(String email, String secret, String task, Integer round, String nonce, String brief,
                        List<JsonNode> checks, String evaluationUrl, List<Attachment> attachments) {
        this.email = email;
        this.secret = secret;
        this.task = task;
        this.round = round;
        this.nonce = nonce;
        this.brief = brief;
        this.checks = checks;
        this.evaluationUrl = evaluationUrl;
        this.attachments = attachments;
    }
}
