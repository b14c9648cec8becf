package org.rostilos.branchtree.core.model.design;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A branch the user intends to exist, optionally linked to the issue or pull request it serves.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesignTreeNode(
    String branchName,
    Integer intendedIssue,
    Integer intendedPr,
    String description
) {
    public static DesignTreeNode of(String branchName) {
        return new DesignTreeNode(branchName, null, null, null);
    }
}
