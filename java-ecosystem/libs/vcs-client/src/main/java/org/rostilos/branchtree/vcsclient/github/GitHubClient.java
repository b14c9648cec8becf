package org.rostilos.branchtree.vcsclient.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.rostilos.branchtree.core.model.pullrequest.EChecksState;
import org.rostilos.branchtree.core.model.pullrequest.EPullRequestState;
import org.rostilos.branchtree.core.model.pullrequest.EReviewDecision;
import org.rostilos.branchtree.core.model.pullrequest.PullRequestFact;
import org.rostilos.branchtree.core.model.repository.RepositorySlug;
import org.rostilos.branchtree.vcsclient.VcsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * VcsClient implementation for GitHub.
 * Pull requests come from the GraphQL API (one round trip including CI and review state),
 * repository metadata from the REST API.
 */
public class GitHubClient implements VcsClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");

    static final String PULL_REQUESTS_QUERY = """
            query($owner: String!, $repo: String!, $first: Int!) {
              repository(owner: $owner, name: $repo) {
                pullRequests(first: $first, states: [OPEN, CLOSED, MERGED], orderBy: {field: UPDATED_AT, direction: DESC}) {
                  nodes {
                    number
                    title
                    state
                    url
                    headRefName
                    isDraft
                    additions
                    deletions
                    changedFiles
                    reviewDecision
                    labels(first: 10) { nodes { name } }
                    assignees(first: 10) { nodes { login } }
                    commits(last: 1) { nodes { commit { statusCheckRollup { state } } } }
                  }
                }
              }
            }
            """;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public GitHubClient(OkHttpClient httpClient) {
        this(httpClient, GitHubConfig.API_BASE);
    }

    public GitHubClient(OkHttpClient httpClient, String apiBase) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }

    @Override
    public List<PullRequestFact> listPullRequests(RepositorySlug repository, int limit) throws IOException {
        int first = Math.max(1, Math.min(limit, GitHubConfig.MAX_PAGE_SIZE));

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", PULL_REQUESTS_QUERY);
        ObjectNode variables = payload.putObject("variables");
        variables.put("owner", repository.owner());
        variables.put("repo", repository.name());
        variables.put("first", first);

        Request request = new Request.Builder()
                .url(apiBase + GitHubConfig.GRAPHQL_PATH)
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON_MEDIA_TYPE))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("list pull requests", response);
            }
            JsonNode root = objectMapper.readTree(response.body().string());

            JsonNode errors = root.path("errors");
            if (errors.isArray() && !errors.isEmpty()) {
                GitHubException cause = GitHubException.graphQl("list pull requests", errors.toString());
                throw new IOException(cause.getMessage(), cause);
            }

            JsonNode nodes = root.path("data").path("repository").path("pullRequests").path("nodes");
            List<PullRequestFact> pullRequests = new ArrayList<>();
            if (!nodes.isArray()) {
                return pullRequests;
            }
            for (JsonNode node : nodes) {
                parsePullRequest(node).ifPresent(pullRequests::add);
            }
            return pullRequests;
        }
    }

    @Override
    public Optional<String> getDefaultBranch(RepositorySlug repository) throws IOException {
        Request request = new Request.Builder()
                .url(apiBase + "/repos/" + repository.owner() + "/" + repository.name())
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("get repository", response);
            }
            JsonNode root = objectMapper.readTree(response.body().string());
            return Optional.ofNullable(getTextOrNull(root, "default_branch"));
        }
    }

    private Optional<PullRequestFact> parsePullRequest(JsonNode node) {
        String headRefName = getTextOrNull(node, "headRefName");
        String stateValue = getTextOrNull(node, "state");
        if (headRefName == null || stateValue == null) {
            log.debug("Skipping pull request without head ref or state: {}", node.path("number").asInt());
            return Optional.empty();
        }

        EPullRequestState state;
        try {
            state = EPullRequestState.fromValue(stateValue);
        } catch (IllegalArgumentException e) {
            log.debug("Skipping pull request #{}: {}", node.path("number").asInt(), e.getMessage());
            return Optional.empty();
        }

        List<String> labels = new ArrayList<>();
        for (JsonNode label : node.path("labels").path("nodes")) {
            String name = getTextOrNull(label, "name");
            if (name != null) {
                labels.add(name);
            }
        }

        List<String> assignees = new ArrayList<>();
        for (JsonNode assignee : node.path("assignees").path("nodes")) {
            String login = getTextOrNull(assignee, "login");
            if (login != null) {
                assignees.add(login);
            }
        }

        JsonNode lastCommit = node.path("commits").path("nodes").path(0).path("commit");
        String rollupState = getTextOrNull(lastCommit.path("statusCheckRollup"), "state");

        return Optional.of(new PullRequestFact(
                node.path("number").asInt(),
                getTextOrNull(node, "title"),
                state,
                getTextOrNull(node, "url"),
                headRefName,
                node.path("isDraft").asBoolean(false),
                labels,
                assignees,
                EReviewDecision.fromValue(getTextOrNull(node, "reviewDecision")).orElse(null),
                EChecksState.fromValue(rollupState).orElse(null),
                node.path("additions").asInt(0),
                node.path("deletions").asInt(0),
                node.path("changedFiles").asInt(0)
        ));
    }

    private String getTextOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private IOException createException(String operation, Response response) throws IOException {
        String body = response.body() != null ? response.body().string() : "";
        GitHubException cause = new GitHubException(operation, response.code(), body);
        return new IOException(cause.getMessage(), cause);
    }
}
