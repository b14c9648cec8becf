package org.rostilos.branchtree.vcsclient.git;

import org.rostilos.branchtree.core.model.branch.AheadBehind;
import org.rostilos.branchtree.vcsclient.command.CommandResult;
import org.rostilos.branchtree.vcsclient.command.ExternalCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Typed read-only queries against a local repository through the git command-line client.
 *
 * <p>Every query maps a failed invocation to an empty result right here, so callers only ever see
 * "answer" or "no answer". Failures are logged at debug level: a missing upstream or a branch deleted
 * mid-scan is an expected outcome, not an incident.
 */
public class GitRepositoryClient {

    private static final Logger log = LoggerFactory.getLogger(GitRepositoryClient.class);

    public static final String DEFAULT_GIT_EXECUTABLE = "git";

    private final ExternalCommandRunner runner;
    private final String gitExecutable;

    public GitRepositoryClient(ExternalCommandRunner runner) {
        this(runner, DEFAULT_GIT_EXECUTABLE);
    }

    public GitRepositoryClient(ExternalCommandRunner runner, String gitExecutable) {
        this.runner = runner;
        this.gitExecutable = gitExecutable != null && !gitExecutable.isBlank()
                ? gitExecutable
                : DEFAULT_GIT_EXECUTABLE;
    }

    /**
     * Run an arbitrary git command in the given directory.
     */
    public CommandResult execute(Path workDir, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(gitExecutable);
        command.addAll(List.of(args));
        return runner.run(workDir, command);
    }

    /**
     * Number of commits reachable from {@code to} but not from {@code from} ({@code from..to}).
     */
    public OptionalInt countCommits(Path repoPath, String from, String to) {
        return stdoutOf(repoPath, "rev-list", "--count", from + ".." + to)
                .map(GitRepositoryClient::parseCount)
                .filter(OptionalInt::isPresent)
                .orElse(OptionalInt.empty());
    }

    /**
     * Symmetric difference {@code left...right}: commits only on left count as behind,
     * commits only on right as ahead.
     */
    public Optional<AheadBehind> leftRightCount(Path repoPath, String left, String right) {
        return stdoutOf(repoPath, "rev-list", "--left-right", "--count", left + "..." + right)
                .flatMap(GitRepositoryClient::parseLeftRight);
    }

    public Optional<String> mergeBase(Path repoPath, String first, String second) {
        return stdoutOf(repoPath, "merge-base", first, second).filter(s -> !s.isEmpty());
    }

    public Optional<String> revParse(Path repoPath, String ref) {
        return stdoutOf(repoPath, "rev-parse", ref).filter(s -> !s.isEmpty());
    }

    /**
     * Whether the tip of {@code candidate} is an ancestor of (or equal to) {@code target}.
     */
    public boolean isTipAncestorOf(Path repoPath, String candidate, String target) {
        Optional<String> mergeBase = mergeBase(repoPath, candidate, target);
        if (mergeBase.isEmpty()) {
            return false;
        }
        return revParse(repoPath, candidate).map(mergeBase.get()::equals).orElse(false);
    }

    /**
     * Short name of the upstream tracking ref (e.g. "origin/feature/x"), if one is configured.
     */
    public Optional<String> upstreamOf(Path repoPath, String branch) {
        return stdoutOf(repoPath, "rev-parse", "--abbrev-ref", branch + "@{upstream}")
                .filter(s -> !s.isEmpty());
    }

    public Optional<String> symbolicRef(Path repoPath, String ref) {
        return stdoutOf(repoPath, "symbolic-ref", ref).filter(s -> !s.isEmpty());
    }

    public Optional<String> remoteUrl(Path repoPath, String remote) {
        return stdoutOf(repoPath, "remote", "get-url", remote).filter(s -> !s.isEmpty());
    }

    public boolean branchExists(Path repoPath, String branch) {
        return stdoutOf(repoPath, "branch", "--list", branch)
                .map(s -> !s.isEmpty())
                .orElse(false);
    }

    /**
     * Porcelain status of a working copy; empty output means clean.
     */
    public Optional<String> statusPorcelain(Path worktreePath) {
        CommandResult result = execute(worktreePath, "status", "--porcelain");
        if (!result.isSuccess()) {
            log.debug("git status failed in {}: {}", worktreePath, result.describeFailure());
            return Optional.empty();
        }
        // untrimmed: leading spaces are significant in porcelain output
        return Optional.of(result.stdout());
    }

    private Optional<String> stdoutOf(Path repoPath, String... args) {
        CommandResult result = execute(repoPath, args);
        if (!result.isSuccess()) {
            log.debug("git {} failed in {}: {}", String.join(" ", args), repoPath, result.describeFailure());
            return Optional.empty();
        }
        return Optional.of(result.trimmedStdout());
    }

    static OptionalInt parseCount(String output) {
        try {
            return OptionalInt.of(Integer.parseInt(output.trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable commit count: '{}'", output);
            return OptionalInt.empty();
        }
    }

    static Optional<AheadBehind> parseLeftRight(String output) {
        String[] parts = output.trim().split("\\s+");
        if (parts.length < 2) {
            log.debug("Unparseable left-right count: '{}'", output);
            return Optional.empty();
        }
        try {
            int behind = Integer.parseInt(parts[0]);
            int ahead = Integer.parseInt(parts[1]);
            return Optional.of(new AheadBehind(ahead, behind));
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable left-right count: '{}'", output);
            return Optional.empty();
        }
    }
}
