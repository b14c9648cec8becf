package org.rostilos.branchtree.topology.builder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.pullrequest.EChecksState;
import org.rostilos.branchtree.core.model.pullrequest.EPullRequestState;
import org.rostilos.branchtree.core.model.pullrequest.EReviewDecision;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.topology.EBadge;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BadgeResolver")
class BadgeResolverTest {

    static PullRequestFact pr(EPullRequestState state, boolean draft, EChecksState checks, EReviewDecision review) {
        return new PullRequestFact(1, "t", state, "u", "feature/x", draft, List.of(), List.of(), review, checks, 0, 0, 0);
    }

    @Test
    void noFactsNoBadges() {
        assertThat(BadgeResolver.resolve(null, null)).isEmpty();
    }

    @Test
    void emitsBadgesInFixedOrder() {
        WorktreeFact worktree = WorktreeFact.of("/wt", "feature/x", "abc").withDirty(true).withActiveAgent("coder-1");

        List<EBadge> badges = BadgeResolver.resolve(worktree,
                pr(EPullRequestState.OPEN, true, EChecksState.FAILURE, EReviewDecision.APPROVED));

        assertThat(badges).containsExactly(EBadge.DIRTY, EBadge.ACTIVE, EBadge.PR, EBadge.DRAFT, EBadge.CI_FAIL,
                EBadge.APPROVED);
    }

    @Test
    void closedAndMergedAreDistinct() {
        assertThat(BadgeResolver.resolve(null, pr(EPullRequestState.MERGED, false, EChecksState.SUCCESS, null)))
                .containsExactly(EBadge.PR_MERGED, EBadge.CI_PASS);
        assertThat(BadgeResolver.resolve(null, pr(EPullRequestState.CLOSED, false, null, EReviewDecision.CHANGES_REQUESTED)))
                .containsExactly(EBadge.PR_CLOSED, EBadge.CHANGES_REQUESTED);
    }

    @Test
    void pendingChecksAndRequiredReviewAddNothing() {
        assertThat(BadgeResolver.resolve(null,
                pr(EPullRequestState.OPEN, false, EChecksState.PENDING, EReviewDecision.REVIEW_REQUIRED)))
                .containsExactly(EBadge.PR);
    }
}
