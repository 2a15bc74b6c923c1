package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.operation.Operation;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.Objects;

/**
 * One value-producing expression of the tracked result type.
 * <p>
 * The id is sequential within one analysis run, and not stable across runs.
 * The lifecycle state is not part of the node: it lives in the node table during the run, and in
 * {@link FlowGraph#nodeStates()} afterwards.
 */
public final class ResultNode {
    private final int id;
    private final Operation producer;
    private final TypeRef type;

    public ResultNode(int id, Operation producer, TypeRef type) {
        this.id = id;
        this.producer = Objects.requireNonNull(producer);
        this.type = Objects.requireNonNull(type);
    }

    public int id() {
        return id;
    }

    // for locating diagnostics only
    public Operation producer() {
        return producer;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof ResultNode other && id == other.id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "ResultNode#" + id + " " + type.displayName();
    }
}
