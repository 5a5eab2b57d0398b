package com.trading.opg.api;

/** An edge endpoint (or another node reference) does not exist in the graph. */
public final class NodeNotFoundException extends GraphException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node '" + nodeId + "' does not exist");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
