package com.trading.opg.api;

/**
 * A parameter entry cannot be mapped onto the canonical shape: it names
 * neither a column nor a value, names both, or repeats the scalar value.
 */
public final class InvalidParameterException extends GraphException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
