package org.rostilos.branchtree.topology.lint;

import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.Optional;

/**
 * A check applied to every node independently of the other rules.
 */
public interface LintRule {

    Optional<Warning> evaluate(TopologyNode node, LintContext context);
}
