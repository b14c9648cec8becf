package org.rostilos.branchtree.topology.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.branchtree.topology.ancestry.AncestryInferencer;
import org.rostilos.branchtree.topology.brief.RestartBriefGenerator;
import org.rostilos.branchtree.topology.builder.TopologyBuilder;
import org.rostilos.branchtree.topology.divergence.DivergenceCalculator;
import org.rostilos.branchtree.topology.lint.TopologyLinter;
import org.rostilos.branchtree.topology.service.DefaultBranchResolver;
import org.rostilos.branchtree.topology.service.TopologyScanService;
import org.rostilos.branchtree.vcsclient.HttpAuthorizedClientFactory;
import org.rostilos.branchtree.vcsclient.VcsClient;
import org.rostilos.branchtree.vcsclient.collector.BranchCollector;
import org.rostilos.branchtree.vcsclient.collector.LivenessMarkerReader;
import org.rostilos.branchtree.vcsclient.collector.PullRequestCollector;
import org.rostilos.branchtree.vcsclient.collector.WorktreeCollector;
import org.rostilos.branchtree.vcsclient.command.ExternalCommandRunner;
import org.rostilos.branchtree.vcsclient.command.ProcessCommandRunner;
import org.rostilos.branchtree.vcsclient.git.GitRepositoryClient;
import org.rostilos.branchtree.vcsclient.github.GitHubClient;
import org.rostilos.branchtree.vcsclient.github.GitHubTokenResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Duration;

/**
 * Auto-configuration for the topology engine.
 * Every bean backs off when the application defines its own, e.g. a different command runner.
 */
@AutoConfiguration
@EnableConfigurationProperties(TopologyEngineProperties.class)
public class TopologyEngineAutoConfiguration {

    static final Duration HTTP_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    @ConditionalOnMissingBean
    public ExternalCommandRunner externalCommandRunner(TopologyEngineProperties properties) {
        return new ProcessCommandRunner(Duration.ofSeconds(properties.getCommandTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public GitRepositoryClient gitRepositoryClient(ExternalCommandRunner runner, TopologyEngineProperties properties) {
        return new GitRepositoryClient(runner, properties.getGitExecutable());
    }

    @Bean
    @ConditionalOnMissingBean
    public BranchCollector branchCollector(GitRepositoryClient gitClient) {
        return new BranchCollector(gitClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public LivenessMarkerReader livenessMarkerReader(
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<Clock> clock,
            TopologyEngineProperties properties
    ) {
        return new LivenessMarkerReader(
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC),
                properties.getLivenessMarkerPath(),
                Duration.ofSeconds(properties.getLivenessWindowSeconds())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public WorktreeCollector worktreeCollector(GitRepositoryClient gitClient, LivenessMarkerReader livenessReader) {
        return new WorktreeCollector(gitClient, livenessReader);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "branchtree.topology", name = "pull-requests-enabled", havingValue = "true", matchIfMissing = true)
    public GitHubTokenResolver gitHubTokenResolver(ExternalCommandRunner runner, TopologyEngineProperties properties) {
        return new GitHubTokenResolver(runner, properties.getGhExecutable(), properties.getGithubToken());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "branchtree.topology", name = "pull-requests-enabled", havingValue = "true", matchIfMissing = true)
    public VcsClient vcsClient(GitHubTokenResolver tokenResolver, TopologyEngineProperties properties) {
        HttpAuthorizedClientFactory factory = new HttpAuthorizedClientFactory(
                HTTP_CONNECT_TIMEOUT,
                Duration.ofSeconds(properties.getCommandTimeoutSeconds())
        );
        return new GitHubClient(factory.createGitHubClient(tokenResolver::resolve), properties.getGithubApiUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "branchtree.topology", name = "pull-requests-enabled", havingValue = "true", matchIfMissing = true)
    public PullRequestCollector pullRequestCollector(VcsClient vcsClient, TopologyEngineProperties properties) {
        return new PullRequestCollector(vcsClient, properties.getPullRequestPageSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public AncestryInferencer ancestryInferencer(GitRepositoryClient gitClient, TopologyEngineProperties properties) {
        return new AncestryInferencer(gitClient, properties.getMaxAncestryCandidates());
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyBuilder topologyBuilder(AncestryInferencer ancestryInferencer) {
        return new TopologyBuilder(ancestryInferencer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DivergenceCalculator divergenceCalculator(GitRepositoryClient gitClient) {
        return new DivergenceCalculator(gitClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyLinter topologyLinter() {
        return new TopologyLinter();
    }

    @Bean
    @ConditionalOnMissingBean
    public RestartBriefGenerator restartBriefGenerator() {
        return new RestartBriefGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultBranchResolver defaultBranchResolver(GitRepositoryClient gitClient, ObjectProvider<VcsClient> vcsClient) {
        return new DefaultBranchResolver(gitClient, vcsClient.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyScanService topologyScanService(
            BranchCollector branchCollector,
            WorktreeCollector worktreeCollector,
            ObjectProvider<PullRequestCollector> pullRequestCollector,
            GitRepositoryClient gitClient,
            DefaultBranchResolver defaultBranchResolver,
            TopologyBuilder topologyBuilder,
            DivergenceCalculator divergenceCalculator,
            TopologyLinter topologyLinter,
            RestartBriefGenerator restartBriefGenerator,
            TopologyEngineProperties properties
    ) {
        return new TopologyScanService(
                branchCollector,
                worktreeCollector,
                pullRequestCollector.getIfAvailable(),
                gitClient,
                defaultBranchResolver,
                topologyBuilder,
                divergenceCalculator,
                topologyLinter,
                restartBriefGenerator,
                properties.isDesignParentsForDivergence()
        );
    }
}
