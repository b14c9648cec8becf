package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.Map;
import java.util.Optional;

/**
 * A non-base branch must match at least one configured pattern. Patterns match anywhere in the name
 * unless they anchor themselves.
 */
public class NamingConventionRule implements LintRule {

    @Override
    public Optional<Warning> evaluate(TopologyNode node, LintContext context) {
        if (context.namingPatterns().isEmpty() || context.isBaseBranch(node.branchName())) {
            return Optional.empty();
        }
        boolean compliant = context.namingPatterns().stream()
                .anyMatch(pattern -> pattern.matcher(node.branchName()).find());
        if (compliant) {
            return Optional.empty();
        }
        return Optional.of(new Warning(
                EWarningSeverity.WARN,
                EWarningCode.BRANCH_NAMING_VIOLATION,
                "Branch " + node.branchName() + " does not follow naming convention",
                Map.of(Warning.META_BRANCH, node.branchName())
        ));
    }
}
