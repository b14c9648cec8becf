package org.rostilos.branchtree.topology.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.branchtree.core.model.branch.AheadBehind;
import org.rostilos.branchtree.core.model.brief.RestartBrief;
import org.rostilos.branchtree.core.model.design.BranchNamingRule;
import org.rostilos.branchtree.core.model.design.DesignTree;
import org.rostilos.branchtree.core.model.design.DesignTreeEdge;
import org.rostilos.branchtree.core.model.lint.EWarningCode;
import org.rostilos.branchtree.core.model.lint.EWarningSeverity;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.pullrequest.EChecksState;
import org.rostilos.branchtree.core.model.pullrequest.EPullRequestState;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;
import org.rostilos.branchtree.core.model.topology.EBadge;
import org.rostilos.branchtree.core.model.topology.EEdgeConfidence;
import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologySnapshot;
import org.rostilos.branchtree.topology.GitFixture;
import org.rostilos.branchtree.topology.ancestry.AncestryInferencer;
import org.rostilos.branchtree.topology.brief.RestartBriefGenerator;
import org.rostilos.branchtree.topology.builder.TopologyBuilder;
import org.rostilos.branchtree.topology.divergence.DivergenceCalculator;
import org.rostilos.branchtree.topology.lint.TopologyLinter;
import org.rostilos.branchtree.vcsclient.VcsClient;
import org.rostilos.branchtree.vcsclient.collector.BranchCollector;
import org.rostilos.branchtree.vcsclient.collector.LivenessMarkerReader;
import org.rostilos.branchtree.vcsclient.collector.PullRequestCollector;
import org.rostilos.branchtree.vcsclient.collector.WorktreeCollector;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.rostilos.branchtree.topology.GitFixture.REPO;

@ExtendWith(MockitoExtension.class)
@DisplayName("TopologyScanService")
class TopologyScanServiceTest {

    private static final String DATE = "2026-10-18 09:00:00 +0000";

    @Mock
    private VcsClient vcsClient;

    private final GitFixture git = new GitFixture();

    private TopologyScanService service(boolean withPullRequests, boolean designParentsForDivergence) {
        GitRepositoryClient client = git.client();
        LivenessMarkerReader liveness = new LivenessMarkerReader(Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC));
        return new TopologyScanService(
                new BranchCollector(client),
                new WorktreeCollector(client, liveness),
                withPullRequests ? new PullRequestCollector(vcsClient, 50) : null,
                client,
                new DefaultBranchResolver(client, withPullRequests ? vcsClient : null),
                new TopologyBuilder(new AncestryInferencer(client)),
                new DivergenceCalculator(client),
                new TopologyLinter(),
                new RestartBriefGenerator(),
                designParentsForDivergence
        );
    }

    private TopologyScanService service() {
        return service(false, true);
    }

    private static List<Warning> warningsOf(TopologySnapshot snapshot, EWarningCode code) {
        return snapshot.warnings().stream().filter(warning -> warning.code() == code).toList();
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("dirty feature branch two commits ahead of main")
        void dirtyFeatureBranch() {
            git.branches("feature/login|a1|" + DATE, "main|b2|" + DATE)
                    .worktrees("""
                            worktree /repo
                            HEAD b2
                            branch refs/heads/main

                            worktree /repo-wt/login
                            HEAD a1
                            branch refs/heads/feature/login
                            """)
                    .clean("/repo").dirty("/repo-wt/login")
                    .count("main", "feature/login", 2)
                    .leftRight("main", "feature/login", 0, 2);

            TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO).withBaseBranch("main"));

            // no naming-prefix parent and only the base as ancestor: the fallback tier
            assertThat(snapshot.edges()).containsExactly(Edge.inferred("main", "feature/login", EEdgeConfidence.LOW));
            assertThat(warningsOf(snapshot, EWarningCode.DIRTY)).hasSize(1);
            assertThat(warningsOf(snapshot, EWarningCode.BEHIND_PARENT)).isEmpty();
            assertThat(snapshot.findNode("feature/login")).hasValueSatisfying(node -> {
                assertThat(node.aheadBehind()).isEqualTo(new AheadBehind(2, 0));
                assertThat(node.badges()).containsExactly(EBadge.DIRTY);
            });
        }

        @Test
        @DisplayName("hotfix six commits behind its parent")
        void hotfixBehindParent() {
            git.branches("hotfix-1|c3|" + DATE, "main|b2|" + DATE)
                    .leftRight("main", "hotfix-1", 6, 1);

            TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO).withBaseBranch("main"));

            assertThat(warningsOf(snapshot, EWarningCode.BEHIND_PARENT)).singleElement().satisfies(warning -> {
                assertThat(warning.severity()).isEqualTo(EWarningSeverity.ERROR);
                assertThat(warning.meta()).containsEntry(Warning.META_BEHIND, 6);
            });
        }

        @Test
        @DisplayName("branch outside the naming convention")
        void namingViolation() {
            git.branches("random-name|d4|" + DATE, "feature/x|e5|" + DATE, "main|b2|" + DATE);

            TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO)
                    .withBaseBranch("main")
                    .withNamingRule(BranchNamingRule.of("^feature/")));

            assertThat(warningsOf(snapshot, EWarningCode.BRANCH_NAMING_VIOLATION))
                    .singleElement()
                    .satisfies(warning -> assertThat(warning.branch()).contains("random-name"));
        }

        @Test
        @DisplayName("design edge for a branch that does not exist yet")
        void designedBranchMissingInGit() {
            git.branches("main|b2|" + DATE);

            TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO)
                    .withBaseBranch("main")
                    .withDesignTree(DesignTree.ofEdges("main", List.of(new DesignTreeEdge("main", "task/a")))));

            assertThat(warningsOf(snapshot, EWarningCode.TREE_DIVERGENCE)).singleElement()
                    .satisfies(warning -> assertThat(warning.meta()).containsEntry(Warning.META_TYPE, Warning.TYPE_MISSING_IN_GIT));
            assertThat(snapshot.edges()).isEmpty();
        }
    }

    @Nested
    @DisplayName("design edges")
    class DesignEdgeTests {

        private final DesignTree design = DesignTree.ofEdges("main", List.of(
                new DesignTreeEdge("epic", "task/a"),
                new DesignTreeEdge("task/a", "main")));

        @Test
        void designParentDrivesDivergenceButNotReconciliation() {
            git.branches("task/a|a1|" + DATE, "epic|e1|" + DATE, "main|b2|" + DATE)
                    .leftRight("main", "task/a", 5, 1)
                    .leftRight("epic", "task/a", 0, 1)
                    .leftRight("main", "epic", 0, 3);

            TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO).withBaseBranch("main").withDesignTree(design));

            assertThat(snapshot.edges()).containsExactly(
                    Edge.inferred("main", "task/a", EEdgeConfidence.LOW),
                    Edge.inferred("main", "epic", EEdgeConfidence.LOW),
                    Edge.designed("epic", "task/a"));
            assertThat(snapshot.inferredEdges()).hasSize(2);
            assertThat(snapshot.findNode("task/a").orElseThrow().aheadBehind()).isEqualTo(new AheadBehind(1, 0));
            assertThat(warningsOf(snapshot, EWarningCode.BEHIND_PARENT)).isEmpty();
            assertThat(warningsOf(snapshot, EWarningCode.TREE_DIVERGENCE)).hasSize(2);
        }

        @Test
        void inferredParentOnlyWhenDisabled() {
            git.branches("task/a|a1|" + DATE, "epic|e1|" + DATE, "main|b2|" + DATE)
                    .leftRight("main", "task/a", 5, 1);

            TopologySnapshot snapshot = service(false, false)
                    .scan(ScanRequest.of(REPO).withBaseBranch("main").withDesignTree(design));

            assertThat(snapshot.edges()).noneMatch(Edge::isDesigned);
            assertThat(warningsOf(snapshot, EWarningCode.BEHIND_PARENT)).singleElement()
                    .satisfies(warning -> assertThat(warning.severity()).isEqualTo(EWarningSeverity.ERROR));
        }
    }

    @Nested
    @DisplayName("pull requests")
    class PullRequestTests {

        @Test
        void repositoryComesFromOriginAndBaseFromHost() throws IOException {
            RepositorySlug slug = new RepositorySlug("acme", "widgets");
            git.branches("feature/login|a1|" + DATE, "develop|d1|" + DATE, "main|b2|" + DATE)
                    .originUrl("git@github.com:acme/widgets.git");
            when(vcsClient.getDefaultBranch(slug)).thenReturn(Optional.of("develop"));
            when(vcsClient.listPullRequests(eq(slug), anyInt())).thenReturn(List.of(
                    new PullRequestFact(12, "Login", EPullRequestState.OPEN, "u", "feature/login", false,
                            List.of(), List.of(), null, EChecksState.FAILURE, 1, 1, 1)));

            TopologySnapshot snapshot = service(true, true).scan(ScanRequest.of(REPO));

            assertThat(snapshot.baseBranch()).isEqualTo("develop");
            assertThat(snapshot.findNode("feature/login").orElseThrow().badges())
                    .containsExactly(EBadge.PR, EBadge.CI_FAIL);
            assertThat(warningsOf(snapshot, EWarningCode.CI_FAIL)).hasSize(1);
        }

        @Test
        void hostingFailureStillYieldsSnapshot() throws IOException {
            RepositorySlug slug = new RepositorySlug("acme", "widgets");
            git.branches("feature/login|a1|" + DATE, "main|b2|" + DATE);
            when(vcsClient.listPullRequests(eq(slug), anyInt())).thenThrow(new IOException("HTTP 502"));

            TopologySnapshot snapshot = service(true, true)
                    .scan(ScanRequest.of(REPO).withBaseBranch("main").withRepository(slug));

            assertThat(snapshot.nodes()).hasSize(2);
            assertThat(snapshot.nodes()).allSatisfy(node -> assertThat(node.pr()).isNull());
        }
    }

    @Test
    @DisplayName("broken git yields an empty snapshot instead of an error")
    void brokenGitYieldsEmptySnapshot() {
        TopologySnapshot snapshot = service().scan(ScanRequest.of(REPO));

        assertThat(snapshot.baseBranch()).isEqualTo("main");
        assertThat(snapshot.nodes()).isEmpty();
        assertThat(snapshot.edges()).isEmpty();
        assertThat(snapshot.warnings()).isEmpty();
    }

    @Test
    @DisplayName("scanning an unchanged repository twice gives identical snapshots")
    void scansAreIdempotent() throws Exception {
        git.branches("feature/login-oauth|f1|" + DATE, "feature/login|a1|" + DATE, "hotfix-1|c3|" + DATE, "main|b2|" + DATE)
                .worktrees("worktree /repo-wt/login\nHEAD a1\nbranch refs/heads/feature/login\n")
                .dirty("/repo-wt/login")
                .leftRight("feature/login", "feature/login-oauth", 2, 1)
                .leftRight("main", "hotfix-1", 7, 1)
                .upstream("main", "origin/main").leftRight("origin/main", "main", 1, 0);
        ScanRequest request = ScanRequest.of(REPO)
                .withBaseBranch("main")
                .withNamingRule(BranchNamingRule.of("^feature/"))
                .withDesignTree(DesignTree.ofEdges("main", List.of(new DesignTreeEdge("main", "task/a"))));
        TopologyScanService service = service();
        ObjectMapper mapper = new ObjectMapper();

        String first = mapper.writeValueAsString(service.scan(request));
        String second = mapper.writeValueAsString(service.scan(request));

        assertThat(first).isEqualTo(second);
        assertThat(first).contains("\"confidence\":\"high\"", "\"severity\":\"error\"", "missing_in_git");
    }

    @Nested
    @DisplayName("restart briefs")
    class BriefTests {

        @Test
        void briefForKnownWorktree() {
            git.branches("feature/login|a1|" + DATE, "main|b2|" + DATE)
                    .worktrees("worktree /repo-wt/login\nHEAD a1\nbranch refs/heads/feature/login\n")
                    .dirty("/repo-wt/login");
            TopologyScanService service = service();
            TopologySnapshot snapshot = service.scan(ScanRequest.of(REPO).withBaseBranch("main"));

            RestartBrief brief = service.restartBrief(snapshot, "/repo-wt/login", null).orElseThrow();

            assertThat(brief.cdCommand()).isEqualTo("cd \"/repo-wt/login\"");
            assertThat(brief.restartPromptMd()).contains("- [WARN] Worktree for feature/login has uncommitted changes");
            assertThat(service.restartBrief(snapshot, "/elsewhere", null)).isEmpty();
        }

        @Test
        void defaultBriefSkipsDetachedWorktrees() {
            git.branches("main|b2|" + DATE)
                    .worktrees("worktree /repo-wt/tmp\nHEAD 9c\ndetached\n\nworktree /repo\nHEAD b2\nbranch refs/heads/main\n")
                    .clean("/repo").clean("/repo-wt/tmp");
            TopologyScanService service = service();
            TopologySnapshot snapshot = service.scan(ScanRequest.of(REPO).withBaseBranch("main"));

            assertThat(service.defaultRestartBrief(snapshot, null))
                    .map(RestartBrief::worktreePath)
                    .contains("/repo");
        }
    }
}
