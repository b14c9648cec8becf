package org.rostilos.branchtree.core.model.branch;

import java.util.Objects;

/**
 * A local branch as reported by git at collection time.
 */
public record BranchFact(
    /**
     * Short branch name (e.g. "feature/login").
     */
    String name,

    /**
     * Abbreviated hash of the branch tip.
     */
    String commitHash,

    /**
     * Committer date of the tip in git's ISO-8601 rendering, kept verbatim.
     */
    String lastCommitAt
) {
    public BranchFact {
        Objects.requireNonNull(name, "name");
        commitHash = commitHash != null ? commitHash : "";
        lastCommitAt = lastCommitAt != null ? lastCommitAt : "";
    }
}
