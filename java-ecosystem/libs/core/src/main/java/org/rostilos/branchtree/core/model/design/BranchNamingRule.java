package org.rostilos.branchtree.core.model.design;

import java.util.List;

/**
 * Project rule listing the regular expressions branch names are expected to match.
 */
public record BranchNamingRule(
    /**
     * Regular expressions; a branch is compliant when any one of them matches.
     */
    List<String> patterns,

    String description,

    /**
     * Example names shown to users; not evaluated.
     */
    List<String> examples
) {
    public BranchNamingRule {
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        examples = examples != null ? List.copyOf(examples) : List.of();
    }

    public static BranchNamingRule of(String... patterns) {
        return new BranchNamingRule(List.of(patterns), null, List.of());
    }

    public boolean hasPatterns() {
        return !patterns.isEmpty();
    }
}
