package org.rostilos.branchtree.topology.config;

import org.rostilos.branchtree.vcsclient.collector.LivenessMarkerReader;
import org.rostilos.branchtree.vcsclient.github.GitHubConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the topology engine.
 */
@ConfigurationProperties(prefix = "branchtree.topology")
public class TopologyEngineProperties {

    /**
     * git executable, resolved through PATH unless absolute.
     */
    private String gitExecutable = "git";

    /**
     * GitHub CLI executable used to obtain a token when none is configured.
     */
    private String ghExecutable = "gh";

    /**
     * Upper bound for a single external command (and for a GitHub API read).
     */
    private int commandTimeoutSeconds = 30;

    /**
     * Liveness marker location relative to each worktree.
     */
    private String livenessMarkerPath = LivenessMarkerReader.DEFAULT_MARKER_PATH;

    /**
     * A worktree is active while its marker is younger than this.
     */
    private int livenessWindowSeconds = 30;

    private int pullRequestPageSize = GitHubConfig.DEFAULT_PAGE_SIZE;

    private String githubApiUrl = GitHubConfig.API_BASE;

    /**
     * Access token; when empty the token printed by "gh auth token" is used.
     */
    private String githubToken = "";

    private boolean pullRequestsEnabled = true;

    /**
     * Candidates probed per branch by commit-graph inference. 0 means no limit.
     */
    private int maxAncestryCandidates = 0;

    /**
     * Whether design tree parents are used for parent divergence.
     */
    private boolean designParentsForDivergence = true;

    // Getters and Setters

    public String getGitExecutable() {
        return gitExecutable;
    }

    public void setGitExecutable(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    public String getGhExecutable() {
        return ghExecutable;
    }

    public void setGhExecutable(String ghExecutable) {
        this.ghExecutable = ghExecutable;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }

    public String getLivenessMarkerPath() {
        return livenessMarkerPath;
    }

    public void setLivenessMarkerPath(String livenessMarkerPath) {
        this.livenessMarkerPath = livenessMarkerPath;
    }

    public int getLivenessWindowSeconds() {
        return livenessWindowSeconds;
    }

    public void setLivenessWindowSeconds(int livenessWindowSeconds) {
        this.livenessWindowSeconds = livenessWindowSeconds;
    }

    public int getPullRequestPageSize() {
        return pullRequestPageSize;
    }

    public void setPullRequestPageSize(int pullRequestPageSize) {
        this.pullRequestPageSize = pullRequestPageSize;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public void setGithubApiUrl(String githubApiUrl) {
        this.githubApiUrl = githubApiUrl;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public void setGithubToken(String githubToken) {
        this.githubToken = githubToken;
    }

    public boolean isPullRequestsEnabled() {
        return pullRequestsEnabled;
    }

    public void setPullRequestsEnabled(boolean pullRequestsEnabled) {
        this.pullRequestsEnabled = pullRequestsEnabled;
    }

    public int getMaxAncestryCandidates() {
        return maxAncestryCandidates;
    }

    public void setMaxAncestryCandidates(int maxAncestryCandidates) {
        this.maxAncestryCandidates = maxAncestryCandidates;
    }

    public boolean isDesignParentsForDivergence() {
        return designParentsForDivergence;
    }

    public void setDesignParentsForDivergence(boolean designParentsForDivergence) {
        this.designParentsForDivergence = designParentsForDivergence;
    }
}
