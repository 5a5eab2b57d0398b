package com.trading.opg.api;

/** A single attempt of a node's operation failed. */
public final class NodeExecutionException extends GraphException {
    private final String nodeId;
    private final int attempt;

    public NodeExecutionException(String nodeId, int attempt, Throwable cause) {
        super("Node '" + nodeId + "' failed on attempt " + attempt + ": " + describe(cause), cause);
        this.nodeId = nodeId;
        this.attempt = attempt;
    }

    public String nodeId() {
        return nodeId;
    }

    public int attempt() {
        return attempt;
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }
}
