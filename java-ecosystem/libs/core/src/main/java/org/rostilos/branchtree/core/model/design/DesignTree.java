package org.rostilos.branchtree.core.model.design;

import java.util.List;

/**
 * The user's declared branch hierarchy. Read-only input; the engine never persists or mutates it.
 */
public record DesignTree(
    String baseBranch,
    List<DesignTreeNode> nodes,
    List<DesignTreeEdge> edges
) {
    public DesignTree {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static DesignTree ofEdges(String baseBranch, List<DesignTreeEdge> edges) {
        return new DesignTree(baseBranch, List.of(), edges);
    }
}
