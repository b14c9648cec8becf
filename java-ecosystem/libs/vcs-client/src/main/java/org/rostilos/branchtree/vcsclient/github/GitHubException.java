package org.rostilos.branchtree.vcsclient.github;

import org.rostilos.branchtree.vcsclient.VcsClientException;

/**
 * Failed GitHub call. GraphQL failures arrive with HTTP 200 and are told apart by {@link #isQueryError()}.
 */
public class GitHubException extends VcsClientException {

    private static final int HTTP_OK = 200;

    private final int statusCode;
    private final String responseBody;
    private final boolean queryError;

    private GitHubException(String message, int statusCode, String responseBody, boolean queryError) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.queryError = queryError;
    }

    public GitHubException(String operation, int statusCode, String responseBody) {
        this(String.format("GitHub API error during %s: HTTP %d - %s", operation, statusCode, responseBody),
                statusCode, responseBody, false);
    }

    /**
     * @param errors the raw {@code errors} array of a GraphQL response
     */
    public static GitHubException graphQl(String operation, String errors) {
        return new GitHubException(String.format("GitHub GraphQL error during %s: %s", operation, errors),
                HTTP_OK, errors, true);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isQueryError() {
        return queryError;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isRateLimited() {
        if (statusCode == 429) {
            return true;
        }
        if (responseBody == null) {
            return false;
        }
        // REST answers 403 with a message, GraphQL reports an error of type RATE_LIMITED
        return (statusCode == 403 && responseBody.contains("rate limit")) || (queryError && responseBody.contains("RATE_LIMITED"));
    }
}
