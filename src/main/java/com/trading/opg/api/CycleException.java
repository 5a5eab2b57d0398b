package com.trading.opg.api;

import java.util.List;

/**
 * Inserting {@code source -> target} would close a cycle. {@link #path()} is
 * the cycle the edge would have formed, starting and ending at {@code source}.
 */
public final class CycleException extends GraphException {
    private final String source;
    private final String target;
    private final List<String> path;

    public CycleException(String source, String target, List<String> path) {
        super("Adding edge " + source + " -> " + target + " would create a cycle: "
                + String.join(" -> ", path));
        this.source = source;
        this.target = target;
        this.path = List.copyOf(path);
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    public List<String> path() {
        return path;
    }
}
