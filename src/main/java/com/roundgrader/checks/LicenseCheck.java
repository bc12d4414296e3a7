package com.roundgrader.checks;

import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;
import com.roundgrader.utils.TextUtils;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Repository-level check that the published revision carries an MIT LICENSE file at its root.
 */
public class LicenseCheck implements RepositoryCheck {
    private static final Logger logger = LoggerFactory.getLogger(LicenseCheck.class);

    public static final String CHECK_NAME = "mit_license";
    private static final Pattern MIT = Pattern.compile("\\bmit\\b", Pattern.CASE_INSENSITIVE);

    private final RawContentClient rawContent;

    public LicenseCheck(RawContentClient rawContent) {
        this.rawContent = rawContent;
    }

    public LicenseCheck(OkHttpClient httpClient, String rawContentBaseUrl) {
        this(new RawContentClient(httpClient, rawContentBaseUrl));
    }

    @Override
    public String name() {
        return CHECK_NAME;
    }

    @Override
    public CheckOutcome check(Submission submission, Task task) {
        return check(submission.getRepoUrl(), submission.getCommitSha());
    }

    public CheckOutcome check(String repoUrl, String commitSha) {
        String ownerRepo = RawContentClient.ownerAndRepo(repoUrl);
        if (ownerRepo == null) {
            return CheckOutcome.failed(CHECK_NAME, "Cannot derive owner/repo from " + repoUrl);
        }
        try {
            RawContentClient.RawFile license = rawContent.fetch(ownerRepo, commitSha, "LICENSE");
            if (!license.found()) {
                return CheckOutcome.failed(CHECK_NAME, "No LICENSE file found: HTTP " + license.statusCode());
            }
            if (MIT.matcher(license.content()).find()) {
                return new CheckOutcome(CHECK_NAME, 1.0, "MIT LICENSE file found in root folder", "");
            }
            return new CheckOutcome(CHECK_NAME, 0.0, "LICENSE file exists but is not MIT",
                    TextUtils.truncate(license.content(), 200));
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Error checking LICENSE for {}: {}", repoUrl, e.getMessage());
            return CheckOutcome.failed(CHECK_NAME, "Error: " + e.getMessage());
        }
    }
}
