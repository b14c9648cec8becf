package org.rostilos.branchtree.topology.brief;

import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.brief.RestartBrief;
import org.rostilos.branchtree.core.model.design.BranchNamingRule;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.topology.TopologyNode;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the markdown handout that lets a user or coding agent pick up work in a worktree.
 * Pure templating: missing optional data renders as an empty or placeholder section.
 */
public class RestartBriefGenerator {

    static final int MAX_NEXT_STEPS = 3;

    public RestartBrief generate(
            WorktreeFact worktree,
            List<TopologyNode> nodes,
            List<Warning> warnings,
            BranchNamingRule namingRule
    ) {
        Objects.requireNonNull(worktree, "worktree");
        String branch = worktree.branch();
        TopologyNode node = nodes.stream()
                .filter(candidate -> candidate.branchName().equals(branch))
                .findFirst()
                .orElse(null);
        List<Warning> branchWarnings = warnings.stream()
                .filter(warning -> warning.concernsBranch(branch))
                .toList();

        StringBuilder md = new StringBuilder();
        md.append("# Restart Prompt\n\n");

        md.append("## Project Rules\n");
        md.append("### Branch Naming\n");
        md.append("- Patterns: ").append(renderPatterns(namingRule)).append("\n\n");

        md.append("## Current State\n");
        md.append("- Branch: `").append(branch != null ? branch : "").append("`\n");
        md.append("- Worktree: `").append(worktree.path()).append("`\n");
        md.append("- Dirty: ").append(worktree.dirty() ? "Yes (uncommitted changes)" : "No").append("\n");
        if (node != null && node.aheadBehind() != null) {
            md.append("- Behind: ").append(node.aheadBehind().behind()).append(" commits\n");
        }
        md.append("\n");

        md.append("## Warnings\n");
        if (branchWarnings.isEmpty()) {
            md.append("No warnings\n");
        } else {
            for (Warning warning : branchWarnings) {
                md.append("- [").append(warning.severity().label()).append("] ")
                        .append(warning.message()).append("\n");
            }
        }
        md.append("\n");

        md.append("## Next Steps\n");
        if (branchWarnings.isEmpty()) {
            md.append("1. Continue working on your current task\n");
        } else {
            int step = 1;
            for (Warning warning : branchWarnings.subList(0, Math.min(MAX_NEXT_STEPS, branchWarnings.size()))) {
                md.append(step++).append(". Address: ").append(warning.message()).append("\n");
            }
        }
        md.append("\n---\n");
        md.append("*Paste this prompt into your coding agent to continue your session.*\n");

        return new RestartBrief(worktree.path(), "cd \"" + worktree.path() + "\"", md.toString());
    }

    private static String renderPatterns(BranchNamingRule namingRule) {
        if (namingRule == null || !namingRule.hasPatterns()) {
            return "N/A";
        }
        return namingRule.patterns().stream()
                .map(pattern -> "`" + pattern + "`")
                .collect(Collectors.joining(", "));
    }
}
