package com.roundgrader.checks;

import com.roundgrader.models.Submission;
import com.roundgrader.models.Task;

/**
 * A check against the submitted repository itself rather than the published page.
 * Implementations report failures as 0-score outcomes and do not throw for remote errors.
 */
public interface RepositoryCheck {

    String name();

    CheckOutcome check(Submission submission, Task task);
}
