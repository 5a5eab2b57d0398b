package com.trading.opg.api;

/** The operation kind is not part of the registry. */
public final class UnknownKindException extends GraphException {
    private final String kind;

    public UnknownKindException(String kind) {
        super("Unsupported operation kind: " + kind);
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}
