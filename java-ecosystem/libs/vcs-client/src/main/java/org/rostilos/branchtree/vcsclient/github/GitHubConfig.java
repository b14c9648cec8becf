package org.rostilos.branchtree.vcsclient.github;

public final class GitHubConfig {

    public static final String API_BASE = "https://api.github.com";
    public static final String GRAPHQL_PATH = "/graphql";

    public static final String ACCEPT_HEADER_VALUE = "application/vnd.github+json";
    public static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
    public static final String API_VERSION = "2022-11-28";
    public static final String USER_AGENT = "branchtree";

    public static final int DEFAULT_PAGE_SIZE = 50;

    /**
     * Hard cap of the GraphQL connection page size.
     */
    public static final int MAX_PAGE_SIZE = 100;

    private GitHubConfig() {
        // Utility class
    }
}
