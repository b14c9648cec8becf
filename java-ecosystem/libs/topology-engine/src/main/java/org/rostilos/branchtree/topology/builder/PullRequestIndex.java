package org.rostilos.branchtree.topology.builder;

import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One pull request per head branch: the open one if there is one, otherwise the first listed,
 * which is the most recently updated in the order the collector returns them.
 */
public class PullRequestIndex {

    private final Map<String, PullRequestFact> byHeadBranch;

    public PullRequestIndex(List<PullRequestFact> pullRequests) {
        Map<String, PullRequestFact> index = new LinkedHashMap<>();
        for (PullRequestFact pr : pullRequests) {
            PullRequestFact current = index.get(pr.headBranch());
            if (current == null || (!current.isOpen() && pr.isOpen())) {
                index.put(pr.headBranch(), pr);
            }
        }
        this.byHeadBranch = index;
    }

    public Optional<PullRequestFact> forBranch(String branchName) {
        return Optional.ofNullable(byHeadBranch.get(branchName));
    }

    public int size() {
        return byHeadBranch.size();
    }
}
