package org.rostilos.branchtree.core.model.pullrequest;

import java.util.Locale;
import java.util.Optional;

/**
 * Rolled-up CI status of a pull request's head commit.
 */
public enum EChecksState {
    SUCCESS,
    FAILURE,
    PENDING,
    ERROR,
    EXPECTED;

    /**
     * Lenient parse; unknown or blank values yield empty.
     */
    public static Optional<EChecksState> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ENGLISH);
        for (EChecksState state : values()) {
            if (state.name().equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
