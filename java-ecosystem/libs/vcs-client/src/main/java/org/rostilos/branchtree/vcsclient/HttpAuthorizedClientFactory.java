package org.rostilos.branchtree.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.branchtree.vcsclient.github.GitHubConfig;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

public class HttpAuthorizedClientFactory {

    private final Duration connectTimeout;
    private final Duration readTimeout;

    public HttpAuthorizedClientFactory(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    /**
     * Create an OkHttpClient configured for GitHub API with bearer token authentication.
     * The token is looked up per request, so a token refreshed through the gh CLI is picked up
     * without rebuilding the client.
     *
     * @param tokenSupplier supplies the GitHub personal access token or OAuth token
     * @return configured OkHttpClient for GitHub API
     */
    public OkHttpClient createGitHubClient(Supplier<Optional<String>> tokenSupplier) {
        if (tokenSupplier == null) {
            throw new IllegalArgumentException("Token supplier cannot be null");
        }

        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout)
                .callTimeout(connectTimeout.plus(readTimeout))
                .addInterceptor(chain -> {
                    String accessToken = tokenSupplier.get()
                            .orElseThrow(() -> new IOException("GitHub token not available"));
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + accessToken)
                            .header("Accept", GitHubConfig.ACCEPT_HEADER_VALUE)
                            .header(GitHubConfig.API_VERSION_HEADER, GitHubConfig.API_VERSION)
                            .header("User-Agent", GitHubConfig.USER_AGENT)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
