package com.roundgrader.build;

import java.util.Map;

/**
 * Publishes a set of files to a public host.
 */
public interface Publisher {

    PublishResult publish(Map<String, String> files, String taskId, int round);

    record PublishResult(boolean success, String repoUrl, String commitSha, String pagesUrl, String error) {

        public static PublishResult published(String repoUrl, String commitSha, String pagesUrl) {
            return new PublishResult(true, repoUrl, commitSha, pagesUrl, null);
        }

        public static PublishResult failed(String error) {
            return new PublishResult(false, null, null, null, error);
        }
    }
}
