package com.roundgrader.tasks;

/**
 * Template lineage could not be resolved, either because the task id is malformed or because it
 * names a template that is not in the catalog. Generation for that participant must stop.
 */
public class TemplateNotFoundException extends RuntimeException {
    private final String templateId;

    public TemplateNotFoundException(String templateId, String message) {
        super(message);
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }
}
