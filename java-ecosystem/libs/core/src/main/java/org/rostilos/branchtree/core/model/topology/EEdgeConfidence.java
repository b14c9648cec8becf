package org.rostilos.branchtree.core.model.topology;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an inferred parent edge was derived.
 * HIGH: naming convention, MEDIUM: commit ancestry, LOW: fallback to the base branch.
 */
public enum EEdgeConfidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String id;

    EEdgeConfidence(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static EEdgeConfidence fromId(String confidenceId) {
        if (confidenceId == null) {
            throw new IllegalArgumentException("Confidence ID cannot be null");
        }
        String normalized = confidenceId.trim().toLowerCase(Locale.ENGLISH);
        for (EEdgeConfidence confidence : values()) {
            if (confidence.id.equals(normalized)) {
                return confidence;
            }
        }
        throw new IllegalArgumentException("Unknown edge confidence: " + confidenceId);
    }
}
