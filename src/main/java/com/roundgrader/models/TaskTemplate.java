package com.roundgrader.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A catalog entry describing one kind of assignment with a configuration per round.
 */
public class TaskTemplate {
    private String id;
    private String name;
    private RoundConfig round1;
    private RoundConfig round2;

    public TaskTemplate() {}

    public TaskTemplate(String id, String name, RoundConfig round1, RoundConfig round2) {
        this.id = id;
        this.name = name;
        this.round1 = round1;
        this.round2 = round2;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public RoundConfig getRound1() {
        return round1;
    }

    public void setRound1(RoundConfig round1) {
        this.round1 = round1;
    }

    public RoundConfig getRound2() {
        return round2;
    }

    public void setRound2(RoundConfig round2) {
        this.round2 = round2;
    }

    /**
     * Round 1 uses its own configuration; every later round uses the follow-up configuration.
     */
    public RoundConfig forRound(int round) {
        return round <= 1 ? round1 : round2;
    }

    @Override
    public String toString() {
        return "TaskTemplate{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                '}';
    }

    /**
     * Brief text with {@code {placeholder}} tokens, the allowed values per token (in declaration
     * order), and the attachments and check descriptors copied verbatim into generated tasks.
     */
    public static class RoundConfig {
        private final String brief;
        private final Map<String, List<String>> params;
        private final List<Attachment> attachments;
        private final List<JsonNode> checks;

        public RoundConfig(String brief, Map<String, List<String>> params,
                           List<Attachment> attachments, List<JsonNode> checks) {
            this.brief = brief;
            this.params = new LinkedHashMap<>(params);
            this.attachments = List.copyOf(attachments);
            this.checks = List.copyOf(checks);
        }

        public String getBrief() { return brief; }
        public Map<String, List<String>> getParams() { return params; }
        public List<Attachment> getAttachments() { return attachments; }
        public List<JsonNode> getChecks() { return checks; }

        @Override
        public String toString() {
            return "RoundConfig{params=" + params.keySet() + ", attachments=" + attachments.size()
                    + ", checks=" + checks.size() + "}";
        }
    }
}
