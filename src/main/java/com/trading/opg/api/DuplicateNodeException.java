package com.trading.opg.api;

/** A node with the same id is already present in the graph. */
public final class DuplicateNodeException extends GraphException {
    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Node with id '" + nodeId + "' already exists");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
