package org.rostilos.branchtree.vcsclient.git;

import org.rostilos.branchtree.core.model.branch.WorktreeFact;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for {@code git worktree list --porcelain} output.
 *
 * <p>Each worktree is a block of lines, the first being {@code worktree <path>}:
 * <pre>
 *   worktree /repo
 *   HEAD 3f2a...
 *   branch refs/heads/main
 *
 *   worktree /repo-wt/detached
 *   HEAD 9c1b...
 *   detached
 * </pre>
 * Dirty and liveness flags are left false; the collector fills them in per worktree.
 */
public final class WorktreePorcelainParser {

    private static final String WORKTREE_PREFIX = "worktree ";
    private static final String HEAD_PREFIX = "HEAD ";
    private static final String BRANCH_PREFIX = "branch ";
    private static final String HEADS_PREFIX = "refs/heads/";

    private WorktreePorcelainParser() {
        // Utility class
    }

    public static List<WorktreeFact> parse(String porcelain) {
        List<WorktreeFact> worktrees = new ArrayList<>();
        if (porcelain == null || porcelain.isBlank()) {
            return worktrees;
        }

        Block current = null;
        for (String rawLine : porcelain.split("\\R")) {
            String line = rawLine.stripTrailing();
            if (line.startsWith(WORKTREE_PREFIX)) {
                if (current != null) {
                    worktrees.add(current.toFact());
                }
                current = new Block(line.substring(WORKTREE_PREFIX.length()));
            } else if (current == null) {
                continue;
            } else if (line.startsWith(HEAD_PREFIX)) {
                current.head = line.substring(HEAD_PREFIX.length());
            } else if (line.startsWith(BRANCH_PREFIX)) {
                String ref = line.substring(BRANCH_PREFIX.length());
                current.branch = ref.startsWith(HEADS_PREFIX) ? ref.substring(HEADS_PREFIX.length()) : ref;
            } else if (line.equals("detached")) {
                current.detached = true;
            } else if (line.equals("bare")) {
                current.bare = true;
            }
        }
        if (current != null) {
            worktrees.add(current.toFact());
        }
        return worktrees;
    }

    private static final class Block {
        private final String path;
        private String head;
        private String branch;
        private boolean detached;
        private boolean bare;

        private Block(String path) {
            this.path = path;
        }

        private WorktreeFact toFact() {
            return new WorktreeFact(path, branch, head, false, false, null, detached, bare);
        }
    }
}
