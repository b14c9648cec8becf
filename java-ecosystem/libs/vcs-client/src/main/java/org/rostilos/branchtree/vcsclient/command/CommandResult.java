package org.rostilos.branchtree.vcsclient.command;

/**
 * Outcome of one external command invocation.
 * Launch failures and timeouts are represented as values, never thrown.
 */
public record CommandResult(
    /**
     * Process exit code; -1 when the process could not be started or was killed.
     */
    int exitCode,

    String stdout,

    String stderr,

    boolean timedOut
) {
    public static final int NOT_STARTED = -1;

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public static CommandResult success(String stdout) {
        return new CommandResult(0, stdout, "", false);
    }

    public static CommandResult exit(int exitCode, String stderr) {
        return new CommandResult(exitCode, "", stderr, false);
    }

    public static CommandResult failure(String reason) {
        return new CommandResult(NOT_STARTED, "", reason, false);
    }

    public static CommandResult timeout(String partialStdout) {
        return new CommandResult(NOT_STARTED, partialStdout, "timed out", true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }

    public String trimmedStdout() {
        return stdout.trim();
    }

    public String describeFailure() {
        if (timedOut) {
            return "timed out";
        }
        String detail = stderr.isBlank() ? "" : ": " + stderr.trim();
        return "exit code " + exitCode + detail;
    }
}
