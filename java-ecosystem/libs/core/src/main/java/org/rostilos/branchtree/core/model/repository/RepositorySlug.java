package org.rostilos.branchtree.core.model.repository;

import java.util.Optional;

/**
 * Owner/name pair identifying a repository on the code-hosting service.
 */
public record RepositorySlug(String owner, String name) {

    public RepositorySlug {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Repository owner cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Repository name cannot be null or blank");
        }
    }

    /**
     * Parse an "owner/name" identifier.
     *
     * @return the slug, or empty when the value does not have exactly two non-blank parts
     */
    public static Optional<RepositorySlug> parse(String repoId) {
        if (repoId == null) {
            return Optional.empty();
        }
        String[] parts = repoId.trim().split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new RepositorySlug(parts[0], parts[1]));
    }

    /**
     * Extract the slug from a remote URL.
     * Handles:
     * - https://github.com/owner/name(.git)
     * - git@github.com:owner/name(.git)
     * - ssh://git@github.com/owner/name(.git)
     */
    public static Optional<RepositorySlug> fromRemoteUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String path = url.trim();

        int schemeIndex = path.indexOf("://");
        if (schemeIndex >= 0) {
            String afterScheme = path.substring(schemeIndex + 3);
            int firstSlash = afterScheme.indexOf('/');
            if (firstSlash < 0) {
                return Optional.empty();
            }
            path = afterScheme.substring(firstSlash + 1);
        } else {
            // scp-like syntax: user@host:owner/name
            int colon = path.indexOf(':');
            if (colon < 0) {
                return Optional.empty();
            }
            path = path.substring(colon + 1);
        }

        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }

        // keep the last two segments; hosts such as GitLab allow nested groups
        String[] segments = path.split("/");
        if (segments.length < 2) {
            return Optional.empty();
        }
        String owner = segments[segments.length - 2];
        String name = segments[segments.length - 1];
        if (owner.isBlank() || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new RepositorySlug(owner, name));
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
