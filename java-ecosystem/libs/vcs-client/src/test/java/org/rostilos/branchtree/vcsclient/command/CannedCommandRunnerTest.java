package org.rostilos.branchtree.vcsclient.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CannedCommandRunner")
class CannedCommandRunnerTest {

    private final CannedCommandRunner runner = new CannedCommandRunner();

    @Test
    void directorySpecificOutputWinsOverAnyDirectory() {
        Path worktree = Path.of("/repo-wt/login");
        runner.output("", "git", "status", "--porcelain")
                .outputIn(worktree, " M README.md\n", "git", "status", "--porcelain");

        assertThat(runner.run(worktree, List.of("git", "status", "--porcelain")).stdout()).isEqualTo(" M README.md\n");
        assertThat(runner.run(Path.of("/repo"), List.of("git", "status", "--porcelain")).stdout()).isEmpty();
    }

    @Test
    void unknownCommandFailsLikeGit() {
        CommandResult result = runner.run(Path.of("/repo"), List.of("git", "rev-parse", "nope"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.exitCode()).isEqualTo(CannedCommandRunner.UNKNOWN_COMMAND_EXIT_CODE);
        assertThat(result.stderr()).isEqualTo("no canned output for: git rev-parse nope");
    }

    @Test
    void recordsInvocations() {
        runner.output("abc", "git", "rev-parse", "main");
        runner.run(Path.of("/repo"), List.of("git", "rev-parse", "main"));
        runner.run(Path.of("/repo"), List.of("git", "merge-base", "a", "b"));

        assertThat(runner.invocations()).hasSize(2);
        assertThat(runner.countInvocations("git", "rev-parse")).isEqualTo(1);
        assertThat(runner.countInvocations("git")).isEqualTo(2);
    }
}
