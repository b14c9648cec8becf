package org.rostilos.branchtree.core.model.lint;

/**
 * Rule identifiers raised by the topology linter.
 */
public enum EWarningCode {
    BEHIND_PARENT,
    DIRTY,
    CI_FAIL,
    BRANCH_NAMING_VIOLATION,
    TREE_DIVERGENCE
}
