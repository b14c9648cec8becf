package org.rostilos.branchtree.topology;

import org.rostilos.branchtree.vcsclient.command.CannedCommandRunner;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;

import java.nio.file.Path;

/**
 * Describes a repository state as canned git output.
 */
public class GitFixture {

    public static final Path REPO = Path.of("/repo");

    private static final String[] STATUS = {"git", "status", "--porcelain"};

    private final CannedCommandRunner runner = new CannedCommandRunner();

    public CannedCommandRunner runner() {
        return runner;
    }

    public GitRepositoryClient client() {
        return new GitRepositoryClient(runner);
    }

    /**
     * Branch lines in {@code name|hash|date} form, most recently committed first.
     */
    public GitFixture branches(String... lines) {
        runner.output(String.join("\n", lines) + "\n",
                "git", "for-each-ref", "--sort=-committerdate",
                "--format=%(refname:short)|%(objectname:short)|%(committerdate:iso8601)", "refs/heads/");
        return this;
    }

    public GitFixture worktrees(String porcelain) {
        runner.output(porcelain, "git", "worktree", "list", "--porcelain");
        return this;
    }

    public GitFixture clean(String worktreePath) {
        runner.outputIn(Path.of(worktreePath), "", STATUS);
        return this;
    }

    public GitFixture dirty(String worktreePath) {
        runner.outputIn(Path.of(worktreePath), " M src/Main.java\n", STATUS);
        return this;
    }

    public GitFixture count(String from, String to, int commits) {
        runner.output(commits + "\n", "git", "rev-list", "--count", from + ".." + to);
        return this;
    }

    public GitFixture tip(String branch) {
        runner.output("sha-" + branch + "\n", "git", "rev-parse", branch);
        return this;
    }

    /**
     * Tip of {@code candidate} lies in the history of {@code target}.
     */
    public GitFixture ancestor(String candidate, String target) {
        tip(candidate);
        runner.output("sha-" + candidate + "\n", "git", "merge-base", candidate, target);
        return this;
    }

    /**
     * {@code candidate} and {@code target} forked from a common commit.
     */
    public GitFixture forked(String candidate, String target) {
        tip(candidate);
        runner.output("sha-fork\n", "git", "merge-base", candidate, target);
        return this;
    }

    public GitFixture leftRight(String left, String right, int behind, int ahead) {
        runner.output(behind + "\t" + ahead + "\n", "git", "rev-list", "--left-right", "--count", left + "..." + right);
        return this;
    }

    public GitFixture upstream(String branch, String upstream) {
        runner.output(upstream + "\n", "git", "rev-parse", "--abbrev-ref", branch + "@{upstream}");
        return this;
    }

    public GitFixture originHead(String branch) {
        runner.output("refs/remotes/origin/" + branch + "\n", "git", "symbolic-ref", "refs/remotes/origin/HEAD");
        return this;
    }

    public GitFixture originUrl(String url) {
        runner.output(url + "\n", "git", "remote", "get-url", "origin");
        return this;
    }
}
