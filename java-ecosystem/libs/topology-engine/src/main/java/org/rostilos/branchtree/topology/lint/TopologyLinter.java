package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.design.BranchNamingRule;
import org.rostilos.branchtree.core.model.design.DesignTree;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs the node rules over every node, then reconciles the design tree.
 */
public class TopologyLinter {

    private static final Logger log = LoggerFactory.getLogger(TopologyLinter.class);

    private final List<LintRule> rules;
    private final DesignTreeReconciler reconciler;

    public TopologyLinter() {
        this(List.of(
                new BehindParentRule(),
                new DirtyWorktreeRule(),
                new CiFailureRule(),
                new NamingConventionRule()
        ), new DesignTreeReconciler());
    }

    public TopologyLinter(List<LintRule> rules, DesignTreeReconciler reconciler) {
        this.rules = List.copyOf(rules);
        this.reconciler = reconciler;
    }

    public List<Warning> lint(
            List<TopologyNode> nodes,
            List<Edge> edges,
            String baseBranch,
            BranchNamingRule namingRule,
            DesignTree designTree
    ) {
        LintContext context = new LintContext(baseBranch, compile(namingRule));
        List<Warning> warnings = new ArrayList<>();

        for (TopologyNode node : nodes) {
            for (LintRule rule : rules) {
                rule.evaluate(node, context).ifPresent(warnings::add);
            }
        }
        warnings.addAll(reconciler.reconcile(designTree, edges));
        return warnings;
    }

    static List<Pattern> compile(BranchNamingRule namingRule) {
        List<Pattern> patterns = new ArrayList<>();
        if (namingRule == null) {
            return patterns;
        }
        for (String pattern : namingRule.patterns()) {
            try {
                patterns.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                log.debug("Skipping invalid naming pattern '{}': {}", pattern, e.getDescription());
            }
        }
        return patterns;
    }
}
