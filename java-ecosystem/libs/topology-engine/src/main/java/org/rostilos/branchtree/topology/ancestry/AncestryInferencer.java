package org.rostilos.branchtree.topology.ancestry;

import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides the most likely parent of a branch.
 *
 * <p>Naming matches short-circuit everything else. Otherwise each candidate is probed with
 * {@code merge-base}/{@code rev-parse} and, when it is an ancestor, a {@code rev-list --count}; that is
 * O(branches) git calls per target. {@code maxCandidates} bounds the probing for large repositories.
 * Every git failure simply removes that candidate from consideration.
 */
public class AncestryInferencer {

    private static final Logger log = LoggerFactory.getLogger(AncestryInferencer.class);

    private final GitRepositoryClient gitClient;
    private final int maxCandidates;

    public AncestryInferencer(GitRepositoryClient gitClient) {
        this(gitClient, 0);
    }

    /**
     * @param maxCandidates upper bound of candidates probed per target in collector order; 0 for no limit
     */
    public AncestryInferencer(GitRepositoryClient gitClient, int maxCandidates) {
        if (maxCandidates < 0) {
            throw new IllegalArgumentException("maxCandidates must not be negative");
        }
        this.gitClient = gitClient;
        this.maxCandidates = maxCandidates;
    }

    /**
     * @param repoPath repository to analyze; when null only the naming tier and the fallback apply
     */
    public ParentInference infer(String target, List<String> branchNames, String baseBranch, Path repoPath) {
        Optional<String> byNaming = ParentSelector.byNaming(target, branchNames, baseBranch);
        if (byNaming.isPresent()) {
            return ParentInference.naming(byNaming.get());
        }
        if (repoPath == null) {
            return ParentInference.fallback(baseBranch);
        }

        OptionalInt baseline = gitClient.countCommits(repoPath, baseBranch, target);
        Map<String, Integer> distances = new HashMap<>();
        int probed = 0;
        for (String candidate : branchNames) {
            if (candidate.equals(target) || candidate.equals(baseBranch)) {
                continue;
            }
            if (maxCandidates > 0 && probed >= maxCandidates) {
                log.debug("Ancestry probing for {} stopped after {} candidates", target, maxCandidates);
                break;
            }
            probed++;
            if (!gitClient.isTipAncestorOf(repoPath, candidate, target)) {
                continue;
            }
            OptionalInt distance = gitClient.countCommits(repoPath, candidate, target);
            if (distance.isPresent()) {
                distances.put(candidate, distance.getAsInt());
            }
        }

        ParentInference inference = ParentSelector.select(target, branchNames, baseBranch, baseline, distances);
        log.debug("Inferred parent of {}: {} ({})", target, inference.parent(), inference.confidence().getId());
        return inference;
    }
}
