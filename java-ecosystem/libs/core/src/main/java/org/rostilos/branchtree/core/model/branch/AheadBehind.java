package org.rostilos.branchtree.core.model.branch;

/**
 * Commit-count divergence of a branch relative to a reference.
 */
public record AheadBehind(int ahead, int behind) {

    public AheadBehind {
        if (ahead < 0 || behind < 0) {
            throw new IllegalArgumentException("Ahead/behind counts cannot be negative: " + ahead + "/" + behind);
        }
    }

    public boolean isZero() {
        return ahead == 0 && behind == 0;
    }
}
