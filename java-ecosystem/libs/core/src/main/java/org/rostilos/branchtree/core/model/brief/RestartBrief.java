package org.rostilos.branchtree.core.model.brief;

/**
 * Resume-context handout for a single worktree.
 */
public record RestartBrief(
    String worktreePath,
    String cdCommand,
    String restartPromptMd
) {
}
