package com.roundgrader.build;

/**
 * A revision was requested for a task that has no recorded deployment.
 */
public class DeploymentNotFoundException extends RuntimeException {
    private final String taskId;

    public DeploymentNotFoundException(String taskId) {
        super("No deployment found for task " + taskId + ". Build round 1 first.");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
