package org.rostilos.branchtree.topology.service;

import org.rostilos.branchtree.core.model.branch.BranchFact;
import org.rostilos.branchtree.core.model.branch.WorktreeFact;
import org.rostilos.branchtree.core.model.brief.RestartBrief;
import org.rostilos.branchtree.core.model.design.BranchNamingRule;
import org.rostilos.branchtree.core.model.design.DesignTree;
import org.rostilos.branchtree.core.model.design.DesignTreeEdge;
import org.rostilos.branchtree.core.model.lint.Warning;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;
import org.rostilos.branchtree.core.model.topology.Edge;
import org.rostilos.branchtree.core.model.topology.TopologyNode;
import org.rostilos.branchtree.core.model.topology.TopologySnapshot;
import org.rostilos.branchtree.topology.brief.RestartBriefGenerator;
import org.rostilos.branchtree.topology.builder.BuiltTopology;
import org.rostilos.branchtree.topology.builder.TopologyBuilder;
import org.rostilos.branchtree.topology.divergence.DivergenceCalculator;
import org.rostilos.branchtree.topology.lint.TopologyLinter;
import org.rostilos.branchtree.vcsclient.collector.BranchCollector;
import org.rostilos.branchtree.vcsclient.collector.PullRequestCollector;
import org.rostilos.branchtree.vcsclient.collector.WorktreeCollector;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one scan: collect facts, infer parents, build the graph, compute divergence, lint.
 *
 * <p>Every stage consumes the previous stage's full output. Nothing is cached between scans, so
 * concurrent scans of the same repository are independent. No stage throws for git or network trouble;
 * a scan always yields a snapshot, possibly with partial data.
 */
public class TopologyScanService {

    private static final Logger log = LoggerFactory.getLogger(TopologyScanService.class);

    static final String ORIGIN_REMOTE = "origin";

    private final BranchCollector branchCollector;
    private final WorktreeCollector worktreeCollector;
    private final PullRequestCollector pullRequestCollector;
    private final GitRepositoryClient gitClient;
    private final DefaultBranchResolver defaultBranchResolver;
    private final TopologyBuilder topologyBuilder;
    private final DivergenceCalculator divergenceCalculator;
    private final TopologyLinter linter;
    private final RestartBriefGenerator briefGenerator;
    private final boolean designParentsForDivergence;

    /**
     * @param pullRequestCollector may be null, in which case no pull requests are attached
     */
    public TopologyScanService(
            BranchCollector branchCollector,
            WorktreeCollector worktreeCollector,
            PullRequestCollector pullRequestCollector,
            GitRepositoryClient gitClient,
            DefaultBranchResolver defaultBranchResolver,
            TopologyBuilder topologyBuilder,
            DivergenceCalculator divergenceCalculator,
            TopologyLinter linter,
            RestartBriefGenerator briefGenerator,
            boolean designParentsForDivergence
    ) {
        this.branchCollector = branchCollector;
        this.worktreeCollector = worktreeCollector;
        this.pullRequestCollector = pullRequestCollector;
        this.gitClient = gitClient;
        this.defaultBranchResolver = defaultBranchResolver;
        this.topologyBuilder = topologyBuilder;
        this.divergenceCalculator = divergenceCalculator;
        this.linter = linter;
        this.briefGenerator = briefGenerator;
        this.designParentsForDivergence = designParentsForDivergence;
    }

    public TopologySnapshot scan(ScanRequest request) {
        long startedAt = System.nanoTime();
        Path repoPath = request.repoPath();
        log.info("Starting topology scan of {}", repoPath);

        List<BranchFact> branches = branchCollector.collect(repoPath);
        RepositorySlug repository = request.repository() != null
                ? request.repository()
                : detectRepository(repoPath).orElse(null);
        String baseBranch = request.baseBranch() != null
                ? request.baseBranch()
                : defaultBranchResolver.resolve(repoPath, branches, repository);

        List<WorktreeFact> worktrees = worktreeCollector.collect(repoPath);
        List<PullRequestFact> pullRequests = pullRequestCollector != null
                ? pullRequestCollector.collect(repository)
                : List.of();

        BuiltTopology built = topologyBuilder.build(branches, worktrees, pullRequests, baseBranch, repoPath);
        List<Edge> edges = assembleEdges(built.edges(), request.designTree(), branches, baseBranch);
        List<TopologyNode> nodes = divergenceCalculator.calculate(repoPath, built.nodes(), edges, baseBranch);
        List<Warning> warnings = linter.lint(nodes, edges, baseBranch, request.namingRule(), request.designTree());

        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
        log.info("Topology scan of {} finished in {} ms: base={}, branches={}, worktrees={}, pullRequests={}, edges={}, warnings={}",
                repoPath, elapsedMs, baseBranch, branches.size(), worktrees.size(), pullRequests.size(),
                edges.size(), warnings.size());

        return new TopologySnapshot(baseBranch, nodes, edges, warnings, worktrees);
    }

    /**
     * Brief for the worktree at {@code worktreePath}; empty if the snapshot has no such worktree.
     */
    public Optional<RestartBrief> restartBrief(TopologySnapshot snapshot, String worktreePath, BranchNamingRule namingRule) {
        return snapshot.worktrees().stream()
                .filter(worktree -> worktree.path().equals(worktreePath))
                .findFirst()
                .map(worktree -> briefGenerator.generate(worktree, snapshot.nodes(), snapshot.warnings(), namingRule));
    }

    /**
     * Brief for the first worktree that has a branch checked out.
     */
    public Optional<RestartBrief> defaultRestartBrief(TopologySnapshot snapshot, BranchNamingRule namingRule) {
        return snapshot.worktrees().stream()
                .filter(WorktreeFact::hasBranch)
                .findFirst()
                .map(worktree -> briefGenerator.generate(worktree, snapshot.nodes(), snapshot.warnings(), namingRule));
    }

    /**
     * Inferred edges followed by the design edges whose child exists, so design parents win the
     * last-wins parent lookup of the divergence stage.
     */
    List<Edge> assembleEdges(List<Edge> inferred, DesignTree designTree, List<BranchFact> branches, String baseBranch) {
        List<Edge> edges = new ArrayList<>(inferred);
        if (!designParentsForDivergence || designTree == null) {
            return edges;
        }
        Set<String> existing = branches.stream().map(BranchFact::name).collect(Collectors.toSet());
        for (DesignTreeEdge declared : designTree.edges()) {
            if (!existing.contains(declared.child()) || declared.child().equals(baseBranch)) {
                continue;
            }
            boolean alreadyInferred = inferred.stream()
                    .anyMatch(edge -> edge.connects(declared.parent(), declared.child()));
            if (!alreadyInferred) {
                edges.add(Edge.designed(declared.parent(), declared.child()));
            }
        }
        return edges;
    }

    private Optional<RepositorySlug> detectRepository(Path repoPath) {
        Optional<RepositorySlug> repository = gitClient.remoteUrl(repoPath, ORIGIN_REMOTE)
                .flatMap(RepositorySlug::fromRemoteUrl);
        if (repository.isEmpty()) {
            log.debug("No hosting repository detected for {}", repoPath);
        }
        return repository;
    }
}
