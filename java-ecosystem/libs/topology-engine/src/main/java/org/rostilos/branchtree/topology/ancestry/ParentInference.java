package org.rostilos.branchtree.topology.ancestry;

import org.rostilos.branchtree.core.model.topology.EEdgeConfidence;

import java.util.Objects;

/**
 * The inferred parent of a branch together with the tier that produced it.
 *
 * @param parent     name of the parent branch; the base branch for LOW confidence
 * @param confidence HIGH for a naming match, MEDIUM for the closest commit ancestor, LOW for the fallback
 */
public record ParentInference(String parent, EEdgeConfidence confidence) {

    public ParentInference {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(confidence, "confidence");
    }

    public static ParentInference naming(String parent) {
        return new ParentInference(parent, EEdgeConfidence.HIGH);
    }

    public static ParentInference ancestry(String parent) {
        return new ParentInference(parent, EEdgeConfidence.MEDIUM);
    }

    public static ParentInference fallback(String baseBranch) {
        return new ParentInference(baseBranch, EEdgeConfidence.LOW);
    }
}
