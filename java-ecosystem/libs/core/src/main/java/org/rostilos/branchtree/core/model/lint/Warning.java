package org.rostilos.branchtree.core.model.lint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One violated rule instance. Recomputed on every scan.
 */
public record Warning(
    EWarningSeverity severity,
    EWarningCode code,
    String message,
    Map<String, Object> meta
) {
    public static final String META_BRANCH = "branch";
    public static final String META_BEHIND = "behind";
    public static final String META_WORKTREE = "worktree";
    public static final String META_PR_NUMBER = "prNumber";
    public static final String META_PARENT = "parent";
    public static final String META_CHILD = "child";
    public static final String META_TYPE = "type";

    public static final String TYPE_MISSING_IN_GIT = "missing_in_git";

    public Warning {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        // insertion order is kept so serialized snapshots are stable
        meta = meta != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(meta))
                : Map.of();
    }

    public Optional<String> branch() {
        Object value = meta.get(META_BRANCH);
        return value != null ? Optional.of(value.toString()) : Optional.empty();
    }

    public boolean concernsBranch(String branchName) {
        return branchName != null && branch().map(branchName::equals).orElse(false);
    }
}
