package org.rostilos.branchtree.topology.divergence;

import org.rostilos.branchtree.core.model.branch.AheadBehind;
import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologyNode;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ahead/behind counts of each node against its parent and against its upstream tracking ref.
 *
 * <p>The parent comes from the edge set passed in; when several edges name the same child the last one
 * wins, so callers append design-declared edges after inferred ones to let them take precedence.
 * Nodes whose refs cannot be compared keep their divergence fields null.
 */
public class DivergenceCalculator {

    private final GitRepositoryClient gitClient;

    public DivergenceCalculator(GitRepositoryClient gitClient) {
        this.gitClient = gitClient;
    }

    public List<TopologyNode> calculate(Path repoPath, List<TopologyNode> nodes, List<Edge> edges, String baseBranch) {
        Map<String, String> parentOf = new HashMap<>();
        for (Edge edge : edges) {
            parentOf.put(edge.child(), edge.parent());
        }

        List<TopologyNode> result = new ArrayList<>(nodes.size());
        for (TopologyNode node : nodes) {
            TopologyNode updated = node;
            String branch = node.branchName();

            if (!branch.equals(baseBranch)) {
                String parent = parentOf.getOrDefault(branch, baseBranch);
                Optional<AheadBehind> aheadBehind = gitClient.leftRightCount(repoPath, parent, branch);
                if (aheadBehind.isPresent()) {
                    updated = updated.withAheadBehind(aheadBehind.get());
                }
            }

            Optional<AheadBehind> remote = remoteDivergence(repoPath, branch);
            if (remote.isPresent()) {
                updated = updated.withRemoteAheadBehind(remote.get());
            }
            result.add(updated);
        }
        return result;
    }

    /**
     * Divergence from the upstream tracking ref; empty when there is no upstream or nothing to report.
     */
    public Optional<AheadBehind> remoteDivergence(Path repoPath, String branch) {
        return gitClient.upstreamOf(repoPath, branch)
                .flatMap(upstream -> gitClient.leftRightCount(repoPath, upstream, branch))
                .filter(counts -> !counts.isZero());
    }
}
