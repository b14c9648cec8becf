package org.rostilos.branchtree.topology.lint;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-run inputs shared by the node rules.
 *
 * @param baseBranch     base branch of the scanned repository
 * @param namingPatterns compiled naming patterns; invalid ones are already dropped
 */
public record LintContext(String baseBranch, List<Pattern> namingPatterns) {

    public LintContext {
        namingPatterns = namingPatterns != null ? List.copyOf(namingPatterns) : List.of();
    }

    public boolean isBaseBranch(String branchName) {
        return branchName.equals(baseBranch);
    }
}
