package com.trading.opg.graph;

import com.trading.opg.api.OperationKind;
import com.trading.opg.api.Parameters;

import java.util.Objects;

/**
 * A node of the operation graph. Immutable; created only by
 * {@link GraphStore#addNode}.
 */
public record OperationNode(String id, OperationKind kind, Parameters parameters) {

    public OperationNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(parameters, "parameters");
    }
}
