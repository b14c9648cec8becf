package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class CiFailureRule implements LintRule {

    @Override
    public Optional<Warning> evaluate(TopologyNode node, LintContext context) {
        if (node.pr() == null || !node.pr().hasFailingChecks()) {
            return Optional.empty();
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(Warning.META_BRANCH, node.branchName());
        meta.put(Warning.META_PR_NUMBER, node.pr().number());
        return Optional.of(new Warning(
                EWarningSeverity.ERROR,
                EWarningCode.CI_FAIL,
                "CI failed for PR #" + node.pr().number() + " (" + node.branchName() + ")",
                meta
        ));
    }
}
