package org.rostilos.branchtree.topology.service;

import org.rostilos.branchtree.core.model.design.BranchNamingRule;
import org.rostilos.branchtree.core.model.design.DesignTree;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Input of one scan.
 *
 * @param repoPath   local repository to scan
 * @param baseBranch base branch; resolved from the repository when null
 * @param repository hosting repository for pull requests; parsed from the origin remote when null
 * @param namingRule project naming rule, may be null
 * @param designTree user's declared branch hierarchy, may be null
 */
public record ScanRequest(
        Path repoPath,
        String baseBranch,
        RepositorySlug repository,
        BranchNamingRule namingRule,
        DesignTree designTree
) {
    public ScanRequest {
        Objects.requireNonNull(repoPath, "repoPath");
        if (baseBranch != null && baseBranch.isBlank()) {
            baseBranch = null;
        }
    }

    public static ScanRequest of(Path repoPath) {
        return new ScanRequest(repoPath, null, null, null, null);
    }

    public ScanRequest withBaseBranch(String value) {
        return new ScanRequest(repoPath, value, repository, namingRule, designTree);
    }

    public ScanRequest withRepository(RepositorySlug value) {
        return new ScanRequest(repoPath, baseBranch, value, namingRule, designTree);
    }

    public ScanRequest withNamingRule(BranchNamingRule value) {
        return new ScanRequest(repoPath, baseBranch, repository, value, designTree);
    }

    public ScanRequest withDesignTree(DesignTree value) {
        return new ScanRequest(repoPath, baseBranch, repository, namingRule, value);
    }
}
