package com.trading.opg.api;

/**
 * Root of every error raised while building, resolving or executing an
 * operation graph.
 *
 * <p>
 * Structural subclasses ({@link DuplicateNodeException},
 * {@link NodeNotFoundException}, {@link UnknownKindException},
 * {@link MissingParameterException}, {@link InvalidParameterException},
 * {@link CycleException}) are raised synchronously by the mutating call and
 * leave the graph exactly as it was.
 */
public abstract class GraphException extends RuntimeException {

    protected GraphException(String message) {
        super(message);
    }

    protected GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
