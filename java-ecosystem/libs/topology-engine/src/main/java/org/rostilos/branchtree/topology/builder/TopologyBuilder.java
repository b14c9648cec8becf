package org.rostilos.branchtree.topology.builder;

import org.rostilos.branchtree.core.model.branch.BranchFact;
import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologyNode;
import org.rostilos.branchtree.topology.ancestry.AncestryInferencer;
import org.rostilos.branchtree.topology.ancestry.ParentInference;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Joins collected facts into one node per branch and one inferred edge per non-base branch.
 */
public class TopologyBuilder {

    private final AncestryInferencer ancestryInferencer;

    public TopologyBuilder(AncestryInferencer ancestryInferencer) {
        this.ancestryInferencer = ancestryInferencer;
    }

    /**
     * @param repoPath repository for commit-graph inference; null restricts inference to branch names
     */
    public BuiltTopology build(
            List<BranchFact> branches,
            List<WorktreeFact> worktrees,
            List<PullRequestFact> pullRequests,
            String baseBranch,
            Path repoPath
    ) {
        Objects.requireNonNull(baseBranch, "baseBranch");
        List<String> branchNames = branches.stream().map(BranchFact::name).toList();
        PullRequestIndex prIndex = new PullRequestIndex(pullRequests);

        List<TopologyNode> nodes = new ArrayList<>(branches.size());
        List<Edge> edges = new ArrayList<>();

        for (BranchFact branch : branches) {
            WorktreeFact worktree = worktreeFor(worktrees, branch.name());
            PullRequestFact pr = prIndex.forBranch(branch.name()).orElse(null);

            nodes.add(new TopologyNode(
                    branch.name(),
                    BadgeResolver.resolve(worktree, pr),
                    pr,
                    worktree,
                    branch.lastCommitAt(),
                    null,
                    null
            ));

            if (!branch.name().equals(baseBranch)) {
                ParentInference inference = ancestryInferencer.infer(branch.name(), branchNames, baseBranch, repoPath);
                edges.add(Edge.inferred(inference.parent(), branch.name(), inference.confidence()));
            }
        }
        return new BuiltTopology(nodes, edges);
    }

    private static WorktreeFact worktreeFor(List<WorktreeFact> worktrees, String branchName) {
        for (WorktreeFact worktree : worktrees) {
            if (branchName.equals(worktree.branch())) {
                return worktree;
            }
        }
        return null;
    }
}
