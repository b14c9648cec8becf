package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.design.DesignTree;
import org.rostilos.branchtree.core.model.design.DesignTreeEdge;
import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.Edge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the design tree against git: every declared (parent, child) pair must appear among the
 * inferred edges. Git edges absent from the design tree are not reported.
 */
public class DesignTreeReconciler {

    public List<Warning> reconcile(DesignTree designTree, List<Edge> edges) {
        List<Warning> warnings = new ArrayList<>();
        if (designTree == null) {
            return warnings;
        }
        List<Edge> actual = edges.stream().filter(edge -> !edge.isDesigned()).toList();

        for (DesignTreeEdge declared : designTree.edges()) {
            boolean present = actual.stream().anyMatch(edge -> edge.connects(declared.parent(), declared.child()));
            if (present) {
                continue;
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(Warning.META_PARENT, declared.parent());
            meta.put(Warning.META_CHILD, declared.child());
            meta.put(Warning.META_TYPE, Warning.TYPE_MISSING_IN_GIT);
            warnings.add(new Warning(
                    EWarningSeverity.WARN,
                    EWarningCode.TREE_DIVERGENCE,
                    "Design tree has " + declared.parent() + " -> " + declared.child() + " but git doesn't match",
                    meta
            ));
        }
        return warnings;
    }
}
