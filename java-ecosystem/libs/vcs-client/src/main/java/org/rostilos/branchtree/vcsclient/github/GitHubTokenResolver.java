package org.rostilos.branchtree.vcsclient.github;

import org.rostilos.branchtree.vcsclient.command.CommandResult;
import org.rostilos.branchtree.vcsclient.command.ExternalCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Supplies the GitHub access token: the configured one if set, otherwise whatever
 * {@code gh auth token} prints for the logged-in CLI user.
 */
public class GitHubTokenResolver {

    private static final Logger log = LoggerFactory.getLogger(GitHubTokenResolver.class);

    public static final String DEFAULT_GH_EXECUTABLE = "gh";

    private final ExternalCommandRunner runner;
    private final String ghExecutable;
    private final String configuredToken;

    public GitHubTokenResolver(ExternalCommandRunner runner, String ghExecutable, String configuredToken) {
        this.runner = runner;
        this.ghExecutable = ghExecutable != null && !ghExecutable.isBlank() ? ghExecutable : DEFAULT_GH_EXECUTABLE;
        this.configuredToken = configuredToken;
    }

    public Optional<String> resolve() {
        if (configuredToken != null && !configuredToken.isBlank()) {
            return Optional.of(configuredToken.trim());
        }
        CommandResult result = runner.run(null, List.of(ghExecutable, "auth", "token"));
        if (!result.isSuccess() || result.trimmedStdout().isEmpty()) {
            log.debug("No GitHub token from {} auth token: {}", ghExecutable, result.describeFailure());
            return Optional.empty();
        }
        return Optional.of(result.trimmedStdout());
    }
}
