package com.trading.opg.api;

/**
 * An internal invariant does not hold, e.g. the resolver could not place every
 * node of a snapshot into a stage. Never expected in correct operation.
 */
public final class ConsistencyException extends GraphException {

    public ConsistencyException(String message) {
        super(message);
    }
}
