package org.rostilos.branchtree.vcsclient.collector;

import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.vcsclient.command.CommandResult;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.rostilos.branchtree.vcsclient.git.WorktreePorcelainParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects worktrees with their dirty and liveness state.
 *
 * <p>Each worktree is probed on its own: a failing dirty probe only clears that worktree's dirty flag.
 */
public class WorktreeCollector {

    private static final Logger log = LoggerFactory.getLogger(WorktreeCollector.class);

    private final GitRepositoryClient gitClient;
    private final LivenessMarkerReader livenessReader;

    public WorktreeCollector(GitRepositoryClient gitClient, LivenessMarkerReader livenessReader) {
        this.gitClient = gitClient;
        this.livenessReader = livenessReader;
    }

    /**
     * @return worktrees of the repository; empty if git fails
     */
    public List<WorktreeFact> collect(Path repoPath) {
        List<WorktreeFact> listed;
        try {
            listed = list(repoPath);
        } catch (RuntimeException e) {
            log.warn("Failed to collect worktrees in {}", repoPath, e);
            return List.of();
        }

        List<WorktreeFact> worktrees = new ArrayList<>(listed.size());
        for (WorktreeFact worktree : listed) {
            worktrees.add(worktree.bare() ? worktree : probe(worktree));
        }
        return worktrees;
    }

    /**
     * Path of the worktree that has {@code branch} checked out.
     */
    public Optional<String> worktreePathFor(Path repoPath, String branch) {
        try {
            return list(repoPath).stream()
                    .filter(worktree -> branch.equals(worktree.branch()))
                    .map(WorktreeFact::path)
                    .findFirst();
        } catch (RuntimeException e) {
            log.warn("Failed to look up worktree for {} in {}", branch, repoPath, e);
            return Optional.empty();
        }
    }

    private List<WorktreeFact> list(Path repoPath) {
        CommandResult result = gitClient.execute(repoPath, "worktree", "list", "--porcelain");
        if (!result.isSuccess()) {
            log.warn("Failed to list worktrees in {}: {}", repoPath, result.describeFailure());
            return List.of();
        }
        return WorktreePorcelainParser.parse(result.stdout());
    }

    private WorktreeFact probe(WorktreeFact worktree) {
        Path path = Path.of(worktree.path());

        WorktreeFact probed = worktree;
        try {
            Optional<String> status = gitClient.statusPorcelain(path);
            if (status.isEmpty()) {
                log.warn("Dirty check failed for worktree {}; treating it as clean", worktree.path());
            }
            probed = probed.withDirty(status.map(s -> !s.isBlank()).orElse(false));
        } catch (RuntimeException e) {
            log.warn("Dirty check failed for worktree {}; treating it as clean", worktree.path(), e);
        }

        try {
            Optional<LivenessMarker> marker = livenessReader.readActive(path);
            if (marker.isPresent()) {
                probed = probed.withActiveAgent(marker.get().agent());
            }
        } catch (RuntimeException e) {
            log.warn("Liveness check failed for worktree {}", worktree.path(), e);
        }
        return probed;
    }
}
