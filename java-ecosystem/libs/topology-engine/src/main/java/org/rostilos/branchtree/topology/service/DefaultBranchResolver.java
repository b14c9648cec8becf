package org.rostilos.branchtree.topology.service;

import org.rostilos.branchtree.core.model.branch.BranchFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;
import org.rostilos.branchtree.vcsclient.VcsClient;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the base branch when the caller did not name one.
 *
 * <p>Order: the branch origin/HEAD points to, the hosting service's default branch, the first existing of
 * develop, main, master, the first collected branch, and finally "main". The first two only count when
 * the branch exists locally.
 */
public class DefaultBranchResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultBranchResolver.class);

    static final String ORIGIN_HEAD_REF = "refs/remotes/origin/HEAD";
    static final String ORIGIN_PREFIX = "refs/remotes/origin/";
    static final List<String> CONVENTIONAL_NAMES = List.of("develop", "main", "master");
    static final String LAST_RESORT = "main";

    private final GitRepositoryClient gitClient;
    private final VcsClient vcsClient;

    /**
     * @param vcsClient hosting service client, may be null when pull requests are disabled
     */
    public DefaultBranchResolver(GitRepositoryClient gitClient, VcsClient vcsClient) {
        this.gitClient = gitClient;
        this.vcsClient = vcsClient;
    }

    public String resolve(Path repoPath, List<BranchFact> branches, RepositorySlug repository) {
        List<String> names = branches.stream().map(BranchFact::name).toList();

        Optional<String> originHead = gitClient.symbolicRef(repoPath, ORIGIN_HEAD_REF)
                .map(ref -> ref.startsWith(ORIGIN_PREFIX) ? ref.substring(ORIGIN_PREFIX.length()) : ref)
                .filter(names::contains);
        if (originHead.isPresent()) {
            return originHead.get();
        }

        Optional<String> hosted = hostedDefault(repository).filter(names::contains);
        if (hosted.isPresent()) {
            return hosted.get();
        }

        for (String conventional : CONVENTIONAL_NAMES) {
            if (names.contains(conventional)) {
                return conventional;
            }
        }
        return names.isEmpty() ? LAST_RESORT : names.get(0);
    }

    private Optional<String> hostedDefault(RepositorySlug repository) {
        if (vcsClient == null || repository == null) {
            return Optional.empty();
        }
        try {
            return vcsClient.getDefaultBranch(repository);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read default branch of {}: {}", repository, e.getMessage());
            return Optional.empty();
        }
    }
}
