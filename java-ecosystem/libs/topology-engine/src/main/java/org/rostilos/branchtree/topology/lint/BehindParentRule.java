package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class BehindParentRule implements LintRule {

    static final int ERROR_THRESHOLD = 5;

    @Override
    public Optional<Warning> evaluate(TopologyNode node, LintContext context) {
        if (node.aheadBehind() == null) {
            return Optional.empty();
        }
        return severityFor(node.aheadBehind().behind()).map(severity -> {
            int behind = node.aheadBehind().behind();
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(Warning.META_BRANCH, node.branchName());
            meta.put(Warning.META_BEHIND, behind);
            return new Warning(
                    severity,
                    EWarningCode.BEHIND_PARENT,
                    "Branch " + node.branchName() + " is " + behind + " commits behind",
                    meta
            );
        });
    }

    /**
     * 0 commits behind: nothing, 1 to 4: warn, 5 or more: error.
     */
    public static Optional<EWarningSeverity> severityFor(int behind) {
        if (behind >= ERROR_THRESHOLD) {
            return Optional.of(EWarningSeverity.ERROR);
        }
        if (behind >= 1) {
            return Optional.of(EWarningSeverity.WARN);
        }
        return Optional.empty();
    }
}
