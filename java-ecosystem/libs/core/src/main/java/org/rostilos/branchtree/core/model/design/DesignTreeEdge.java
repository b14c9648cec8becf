package org.rostilos.branchtree.core.model.design;

import java.util.Objects;

public record DesignTreeEdge(String parent, String child) {

    public DesignTreeEdge {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
    }
}
