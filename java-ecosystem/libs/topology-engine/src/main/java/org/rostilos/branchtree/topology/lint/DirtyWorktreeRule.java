package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class DirtyWorktreeRule implements LintRule {

    @Override
    public Optional<Warning> evaluate(TopologyNode node, LintContext context) {
        if (!node.hasDirtyWorktree()) {
            return Optional.empty();
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(Warning.META_BRANCH, node.branchName());
        meta.put(Warning.META_WORKTREE, node.worktree().path());
        return Optional.of(new Warning(
                EWarningSeverity.WARN,
                EWarningCode.DIRTY,
                "Worktree for " + node.branchName() + " has uncommitted changes",
                meta
        ));
    }
}
