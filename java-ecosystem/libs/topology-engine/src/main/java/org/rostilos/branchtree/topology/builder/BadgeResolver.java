package org.rostilos.branchtree.topology.builder;

import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.pullrequest.EChecksState;
import org.rostilos.branchtree.core.model.pullrequest.EPullRequestState;
import org.rostilos.branchtree.core.model.pullrequest.EReviewDecision;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.topology.EBadge;

import java.util.EnumSet;
import java.util.List;

/**
 * Derives display badges from a branch's worktree and pull request.
 */
public final class BadgeResolver {

    private BadgeResolver() {
        // Utility class
    }

    public static List<EBadge> resolve(WorktreeFact worktree, PullRequestFact pr) {
        EnumSet<EBadge> badges = EnumSet.noneOf(EBadge.class);
        if (worktree != null) {
            if (worktree.dirty()) {
                badges.add(EBadge.DIRTY);
            }
            if (worktree.isActive()) {
                badges.add(EBadge.ACTIVE);
            }
        }
        if (pr != null) {
            badges.add(stateBadge(pr.state()));
            if (pr.isDraft()) {
                badges.add(EBadge.DRAFT);
            }
            if (pr.checksState() == EChecksState.FAILURE) {
                badges.add(EBadge.CI_FAIL);
            } else if (pr.checksState() == EChecksState.SUCCESS) {
                badges.add(EBadge.CI_PASS);
            }
            if (pr.reviewDecision() == EReviewDecision.APPROVED) {
                badges.add(EBadge.APPROVED);
            } else if (pr.reviewDecision() == EReviewDecision.CHANGES_REQUESTED) {
                badges.add(EBadge.CHANGES_REQUESTED);
            }
        }
        // EnumSet iterates in declaration order
        return List.copyOf(badges);
    }

    private static EBadge stateBadge(EPullRequestState state) {
        return switch (state) {
            case OPEN -> EBadge.PR;
            case MERGED -> EBadge.PR_MERGED;
            case CLOSED -> EBadge.PR_CLOSED;
        };
    }
}
