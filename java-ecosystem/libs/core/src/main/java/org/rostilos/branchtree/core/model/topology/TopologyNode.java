package org.rostilos.branchtree.core.model.topology;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.rostilos.branchtree.core.model.branch.AheadBehind;
import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;

import java.util.List;
import java.util.Objects;

/**
 * Per-branch view assembled from collected facts.
 * Divergence fields stay null until computed and remain null when git cannot compare the refs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopologyNode(
    String branchName,
    List<EBadge> badges,
    PullRequestFact pr,
    WorktreeFact worktree,
    String lastCommitAt,
    AheadBehind aheadBehind,
    AheadBehind remoteAheadBehind
) {
    public TopologyNode {
        Objects.requireNonNull(branchName, "branchName");
        badges = badges != null ? List.copyOf(badges) : List.of();
    }

    public boolean hasDirtyWorktree() {
        return worktree != null && worktree.dirty();
    }

    public TopologyNode withAheadBehind(AheadBehind value) {
        return new TopologyNode(branchName, badges, pr, worktree, lastCommitAt, value, remoteAheadBehind);
    }

    public TopologyNode withRemoteAheadBehind(AheadBehind value) {
        return new TopologyNode(branchName, badges, pr, worktree, lastCommitAt, aheadBehind, value);
    }
}
