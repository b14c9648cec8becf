package org.rostilos.branchtree.core.model.topology;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display-oriented markers attached to a topology node.
 * Declaration order is the order badges are rendered in.
 */
public enum EBadge {
    DIRTY("dirty"),
    ACTIVE("active"),
    PR("pr"),
    PR_MERGED("pr-merged"),
    PR_CLOSED("pr-closed"),
    DRAFT("draft"),
    CI_FAIL("ci-fail"),
    CI_PASS("ci-pass"),
    APPROVED("approved"),
    CHANGES_REQUESTED("changes-requested");

    private final String id;

    EBadge(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
