package org.rostilos.branchtree.vcsclient.collector;

import org.rostilos.branchtree.core.model.branch.BranchFact;
import org.rostilos.branchtree.vcsclient.command.CommandResult;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects local branches, most recently committed first.
 */
public class BranchCollector {

    private static final Logger log = LoggerFactory.getLogger(BranchCollector.class);

    static final String FIELD_SEPARATOR = "|";

    private static final String FORMAT =
            "--format=%(refname:short)|%(objectname:short)|%(committerdate:iso8601)";

    private final GitRepositoryClient gitClient;

    public BranchCollector(GitRepositoryClient gitClient) {
        this.gitClient = gitClient;
    }

    /**
     * @return branches of the repository; empty if git fails
     */
    public List<BranchFact> collect(Path repoPath) {
        try {
            CommandResult result = gitClient.execute(repoPath,
                    "for-each-ref", "--sort=-committerdate", FORMAT, "refs/heads/");
            if (!result.isSuccess()) {
                log.warn("Failed to list branches in {}: {}", repoPath, result.describeFailure());
                return List.of();
            }
            return parse(result.stdout());
        } catch (RuntimeException e) {
            log.warn("Failed to collect branches in {}", repoPath, e);
            return List.of();
        }
    }

    static List<BranchFact> parse(String output) {
        List<BranchFact> branches = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.trim().split("\\|", 3);
            String name = parts[0];
            if (name.isEmpty()) {
                continue;
            }
            String commit = parts.length > 1 ? parts[1] : "";
            String lastCommitAt = parts.length > 2 ? parts[2] : "";
            branches.add(new BranchFact(name, commit, lastCommitAt));
        }
        return branches;
    }
}
