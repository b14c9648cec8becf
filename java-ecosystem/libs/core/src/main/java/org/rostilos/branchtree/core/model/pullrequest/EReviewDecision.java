package org.rostilos.branchtree.core.model.pullrequest;

import java.util.Locale;
import java.util.Optional;

public enum EReviewDecision {
    APPROVED,
    CHANGES_REQUESTED,
    REVIEW_REQUIRED;

    public static Optional<EReviewDecision> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ENGLISH).replace('-', '_');
        for (EReviewDecision decision : values()) {
            if (decision.name().equals(normalized)) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }
}
