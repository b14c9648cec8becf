package org.rostilos.branchtree.vcsclient.command;

import java.nio.file.Path;
import java.util.List;

/**
 * Capability boundary for invoking local command-line tools (git, gh).
 * Implementations must bound every call with a timeout and report failures through
 * {@link CommandResult} instead of throwing.
 */
public interface ExternalCommandRunner {

    /**
     * Run a command and wait for it to finish.
     * @param workDir working directory; null means the current directory
     * @param command executable followed by its arguments
     * @return the captured result
     */
    CommandResult run(Path workDir, List<String> command);
}
