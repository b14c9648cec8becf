package org.rostilos.branchtree.vcsclient.command;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays pre-recorded command output instead of spawning processes.
 *
 * <p>Lets the collectors and the ancestry heuristics run against a described repository state without a
 * real checkout. Output registered for a specific working directory wins over output registered for any
 * directory. Commands without a registered result fail with exit code 128, the way git reports an unknown
 * revision.
 */
public class CannedCommandRunner implements ExternalCommandRunner {

    public static final int UNKNOWN_COMMAND_EXIT_CODE = 128;

    private final Map<String, CommandResult> anyDirectory = new HashMap<>();
    private final Map<String, CommandResult> perDirectory = new HashMap<>();
    private final List<List<String>> invocations = new ArrayList<>();

    public CannedCommandRunner stub(CommandResult result, String... command) {
        anyDirectory.put(key(List.of(command)), result);
        return this;
    }

    public CannedCommandRunner stubIn(Path workDir, CommandResult result, String... command) {
        perDirectory.put(directoryKey(workDir, List.of(command)), result);
        return this;
    }

    public CannedCommandRunner output(String stdout, String... command) {
        return stub(CommandResult.success(stdout), command);
    }

    public CannedCommandRunner outputIn(Path workDir, String stdout, String... command) {
        return stubIn(workDir, CommandResult.success(stdout), command);
    }

    public CannedCommandRunner fail(String... command) {
        return stub(CommandResult.exit(UNKNOWN_COMMAND_EXIT_CODE, "fatal: canned failure"), command);
    }

    @Override
    public synchronized CommandResult run(Path workDir, List<String> command) {
        invocations.add(List.copyOf(command));
        CommandResult result = perDirectory.get(directoryKey(workDir, command));
        if (result == null) {
            result = anyDirectory.get(key(command));
        }
        if (result == null) {
            return CommandResult.exit(UNKNOWN_COMMAND_EXIT_CODE, "no canned output for: " + String.join(" ", command));
        }
        return result;
    }

    public synchronized List<List<String>> invocations() {
        return List.copyOf(invocations);
    }

    public synchronized long countInvocations(String... commandPrefix) {
        List<String> prefix = List.of(commandPrefix);
        return invocations.stream()
                .filter(command -> command.size() >= prefix.size()
                        && command.subList(0, prefix.size()).equals(prefix))
                .count();
    }

    private static String key(List<String> command) {
        return String.join("\u0000", command);
    }

    private static String directoryKey(Path workDir, List<String> command) {
        String dir = workDir != null ? workDir.toString() : "";
        return dir + "\u0001" + key(command);
    }
}
