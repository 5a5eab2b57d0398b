package com.trading.opg.graph;

import java.util.Objects;

/** Dependency {@code source -> target}: the target runs after the source. */
public record Edge(String source, String target) {

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
