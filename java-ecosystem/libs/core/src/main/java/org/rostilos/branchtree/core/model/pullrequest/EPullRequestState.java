package org.rostilos.branchtree.core.model.pullrequest;

import java.util.Locale;

/**
 * Lifecycle state of a pull request on the code-hosting service.
 */
public enum EPullRequestState {
    OPEN,
    CLOSED,
    MERGED;

    public static EPullRequestState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Pull request state cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown pull request state: " + value);
        }
    }
}
