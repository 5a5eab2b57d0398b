package com.trading.opg.api;

import java.util.List;
import java.util.Set;

/**
 * The supplied parameters do not cover every name the operation kind requires.
 * {@link #missing()} is ordered like the registry's required list.
 */
public final class MissingParameterException extends GraphException {
    private final OperationKind kind;
    private final List<String> required;
    private final Set<String> supplied;
    private final List<String> missing;

    public MissingParameterException(OperationKind kind, List<String> required, Set<String> supplied,
            List<String> missing) {
        super("Missing required parameters " + missing + " for kind " + kind
                + " (required " + required + ", supplied " + supplied + ")");
        this.kind = kind;
        this.required = List.copyOf(required);
        this.supplied = Set.copyOf(supplied);
        this.missing = List.copyOf(missing);
    }

    public OperationKind kind() {
        return kind;
    }

    public List<String> required() {
        return required;
    }

    public Set<String> supplied() {
        return supplied;
    }

    public List<String> missing() {
        return missing;
    }
}
