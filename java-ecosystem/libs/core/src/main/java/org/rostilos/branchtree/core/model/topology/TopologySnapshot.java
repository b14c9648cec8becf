package org.rostilos.branchtree.core.model.topology;

import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.lint.Warning;

import java.util.List;
import java.util.Optional;

/**
 * Point-in-time output of one scan. Nothing here is persisted by the engine.
 */
public record TopologySnapshot(
    String baseBranch,
    List<TopologyNode> nodes,
    List<Edge> edges,
    List<Warning> warnings,
    List<WorktreeFact> worktrees
) {
    public TopologySnapshot {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        worktrees = worktrees != null ? List.copyOf(worktrees) : List.of();
    }

    public static TopologySnapshot empty(String baseBranch) {
        return new TopologySnapshot(baseBranch, List.of(), List.of(), List.of(), List.of());
    }

    public Optional<TopologyNode> findNode(String branchName) {
        return nodes.stream()
                .filter(node -> node.branchName().equals(branchName))
                .findFirst();
    }

    public List<Edge> inferredEdges() {
        return edges.stream().filter(edge -> !edge.isDesigned()).toList();
    }
}
