package org.rostilos.branchtree.vcsclient.collector;

import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;
import org.rostilos.branchtree.vcsclient.VcsClient;
import org.rostilos.branchtree.vcsclient.github.GitHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Collects pull requests from the code-hosting service, degrading to an empty list on any failure.
 */
public class PullRequestCollector {

    private static final Logger log = LoggerFactory.getLogger(PullRequestCollector.class);

    private final VcsClient vcsClient;
    private final int pageSize;

    public PullRequestCollector(VcsClient vcsClient, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.vcsClient = vcsClient;
        this.pageSize = pageSize;
    }

    public List<PullRequestFact> collect(RepositorySlug repository) {
        if (repository == null) {
            log.info("No repository slug available; skipping pull request collection");
            return List.of();
        }
        try {
            List<PullRequestFact> pullRequests = vcsClient.listPullRequests(repository, pageSize);
            log.debug("Collected {} pull requests for {}", pullRequests.size(), repository);
            return pullRequests;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to collect pull requests for {}: {}", repository, describe(e));
            return List.of();
        }
    }

    private static String describe(Exception e) {
        if (e.getCause() instanceof GitHubException gitHubException) {
            if (gitHubException.isUnauthorized()) {
                return "token rejected; set a token or run 'gh auth login'";
            }
            if (gitHubException.isRateLimited()) {
                return "rate limit exceeded";
            }
        }
        return e.getMessage();
    }
}
