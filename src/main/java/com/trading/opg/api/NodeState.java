package com.trading.opg.api;

/** Per-attempt state of a node inside a run. */
public enum NodeState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
