package org.rostilos.branchtree.topology.builder;

import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.List;

/**
 * Nodes and inferred edges before divergence and linting.
 */
public record BuiltTopology(List<TopologyNode> nodes, List<Edge> edges) {

    public BuiltTopology {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
