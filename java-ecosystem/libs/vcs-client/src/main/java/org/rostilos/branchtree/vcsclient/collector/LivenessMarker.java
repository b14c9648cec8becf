package org.rostilos.branchtree.vcsclient.collector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Heartbeat file an agent refreshes while it works inside a worktree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LivenessMarker(
    String agent,
    Long pid,
    /**
     * ISO-8601 instant of the last refresh.
     */
    String updatedAt
) {
}
