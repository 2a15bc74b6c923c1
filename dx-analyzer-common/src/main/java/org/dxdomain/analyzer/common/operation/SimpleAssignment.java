package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class SimpleAssignment implements Operation {
    private final Operation target;
    private final Operation value;
    private final Source source;
    private final List<Operation> children;

    public SimpleAssignment(Operation target, Operation value, Source source) {
        this.target = Objects.requireNonNull(target);
        this.value = Objects.requireNonNull(value);
        this.source = source;
        this.children = Children.of(target, value);
    }

    public Operation target() {
        return target;
    }

    public Operation value() {
        return value;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.SIMPLE_ASSIGNMENT;
    }

    @Override
    public TypeRef type() {
        return target.type();
    }

    @Override
    public List<Operation> children() {
        return children;
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public String toString() {
        return target + " = " + value;
    }
}
