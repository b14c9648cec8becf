package org.rostilos.branchtree.vcsclient.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProcessCommandRunner")
class ProcessCommandRunnerTest {

    @TempDir
    Path workDir;

    @Nested
    @DisplayName("constructor")
    class ConstructorTests {

        @Test
        void rejectsNonPositiveTimeout() {
            assertThatThrownBy(() -> new ProcessCommandRunner(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ProcessCommandRunner(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void keepsTimeout() {
            assertThat(new ProcessCommandRunner(Duration.ofSeconds(3)).getTimeout()).isEqualTo(Duration.ofSeconds(3));
        }
    }

    @Test
    void missingExecutableIsAFailureResult() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));

        CommandResult result = runner.run(workDir, List.of("branchtree-no-such-binary-42"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.exitCode()).isEqualTo(CommandResult.NOT_STARTED);
        assertThat(result.timedOut()).isFalse();
    }

    @Test
    void rejectsEmptyCommand() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));

        assertThatThrownBy(() -> runner.run(workDir, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("with a POSIX shell")
    class ShellTests {

        @Test
        void capturesStdoutAndExitCode() {
            ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(5));

            CommandResult result = runner.run(workDir, List.of("sh", "-c", "echo hello; echo oops 1>&2; exit 3"));

            assertThat(result.exitCode()).isEqualTo(3);
            assertThat(result.trimmedStdout()).isEqualTo("hello");
            assertThat(result.stderr()).contains("oops");
        }

        @Test
        void killsCommandsThatOutliveTheTimeout() {
            ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofMillis(200));

            CommandResult result = runner.run(workDir, List.of("sh", "-c", "sleep 5"));

            assertThat(result.timedOut()).isTrue();
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.describeFailure()).isEqualTo("timed out");
        }
    }
}
