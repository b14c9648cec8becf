package org.rostilos.branchtree.core.model.lint;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EWarningSeverity {
    WARN("warn"),
    ERROR("error");

    private final String id;

    EWarningSeverity(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Upper-case label used in rendered briefs, e.g. "[WARN]".
     */
    public String label() {
        return id.toUpperCase(Locale.ENGLISH);
    }
}
