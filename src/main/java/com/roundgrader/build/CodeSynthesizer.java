package com.roundgrader.build;

import com.fasterxml.jackson.databind.JsonNode;
import com.roundgrader.models.Attachment;

import java.util.List;
import java.util.Map;

/**
 * Produces application source files for a brief. Implementations talk to whatever generator
 * the deployment uses; the workflow only sees file name to content.
 */
public interface CodeSynthesizer {

    /**
     * @param existingFiles files of the current deployment when revising, empty for a first build
     * @return file name to file content, possibly empty on failure
     */
    Map<String, String> generate(String brief, List<JsonNode> checks, List<Attachment> attachments,
                                 String taskId, Map<String, String> existingFiles);
}
