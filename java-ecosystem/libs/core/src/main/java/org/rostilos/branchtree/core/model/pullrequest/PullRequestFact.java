package org.rostilos.branchtree.core.model.pullrequest;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * A pull request as returned by the code-hosting service.
 * Common fields across providers; provider-specific data is not retained.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PullRequestFact(
    int number,

    String title,

    EPullRequestState state,

    /**
     * Web URL of the pull request.
     */
    String url,

    /**
     * Name of the source branch the pull request was opened from.
     */
    String headBranch,

    boolean isDraft,

    List<String> labels,

    /**
     * Logins of the assigned users.
     */
    List<String> assignees,

    /**
     * Review decision; null when the service reports none.
     */
    EReviewDecision reviewDecision,

    /**
     * Rolled-up CI status of the last commit; null when no checks ran.
     */
    EChecksState checksState,

    int additions,

    int deletions,

    int changedFiles
) {
    public PullRequestFact {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(headBranch, "headBranch");
        labels = labels != null ? List.copyOf(labels) : List.of();
        assignees = assignees != null ? List.copyOf(assignees) : List.of();
    }

    public boolean isOpen() {
        return state == EPullRequestState.OPEN;
    }

    public boolean hasFailingChecks() {
        return checksState == EChecksState.FAILURE;
    }
}
