package org.rostilos.branchtree.core.model.topology;

import java.util.Objects;

/**
 * A parent/child relationship between two branches.
 * Inferred edges come from git state; designed edges are copied from the user's design tree.
 * Both kinds may coexist for the same child.
 */
public record Edge(
    String parent,
    String child,
    EEdgeConfidence confidence,
    boolean isDesigned
) {
    public Edge {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(confidence, "confidence");
    }

    public static Edge inferred(String parent, String child, EEdgeConfidence confidence) {
        return new Edge(parent, child, confidence, false);
    }

    /**
     * Designed edges are user assertions; they carry HIGH confidence.
     */
    public static Edge designed(String parent, String child) {
        return new Edge(parent, child, EEdgeConfidence.HIGH, true);
    }

    public boolean connects(String parentName, String childName) {
        return parent.equals(parentName) && child.equals(childName);
    }
}
