package com.roundgrader.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Content produced by the task generator for one participant, round and hour.
 */
public record GeneratedTask(String templateId, String taskId, int round, String brief,
                            List<Attachment> attachments, List<JsonNode> checks) {
}
