package org.rostilos.branchtree.core.model.branch;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A git worktree with its working-copy and liveness state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorktreeFact(
    /**
     * Absolute worktree path as listed by git.
     */
    String path,

    /**
     * Checked-out branch; null when HEAD is detached or the entry is bare.
     */
    String branch,

    /**
     * Full HEAD commit hash; may be null for bare entries.
     */
    String commitHash,

    /**
     * Whether the working copy has uncommitted changes.
     */
    boolean dirty,

    /**
     * Whether a liveness marker was refreshed within the liveness window.
     */
    boolean isActive,

    /**
     * Agent named in the liveness marker; null unless active.
     */
    String activeAgent,

    boolean detached,

    boolean bare
) {
    public WorktreeFact {
        Objects.requireNonNull(path, "path");
    }

    public static WorktreeFact of(String path, String branch, String commitHash) {
        return new WorktreeFact(path, branch, commitHash, false, false, null, false, false);
    }

    public boolean hasBranch() {
        return branch != null && !branch.isEmpty();
    }

    public WorktreeFact withDirty(boolean value) {
        return new WorktreeFact(path, branch, commitHash, value, isActive, activeAgent, detached, bare);
    }

    public WorktreeFact withActiveAgent(String agent) {
        return new WorktreeFact(path, branch, commitHash, dirty, true, agent, detached, bare);
    }
}
