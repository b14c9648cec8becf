package org.rostilos.branchtree.vcsclient;

import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the code-hosting service.
 * Provider-specific implementations (GitHubClient, ...) implement this interface.
 */
public interface VcsClient {

    /**
     * List pull requests of a repository, most recently updated first.
     * @param repository owner/name of the repository
     * @param limit maximum number of pull requests to return
     * @return pull requests in all states (open, closed, merged)
     */
    List<PullRequestFact> listPullRequests(RepositorySlug repository, int limit) throws IOException;

    /**
     * Get the default branch name configured on the service.
     * @param repository owner/name of the repository
     * @return default branch name, empty when the service reports none
     */
    Optional<String> getDefaultBranch(RepositorySlug repository) throws IOException;
}
