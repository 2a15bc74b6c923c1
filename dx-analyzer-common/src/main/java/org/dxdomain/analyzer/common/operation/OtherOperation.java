package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

/*
Any shape without a dedicated kind: binary and unary operators, expression statements, throw, ...
The description is for printing and fingerprinting only.
 */
public final class OtherOperation implements Operation {
    private final String description;
    private final List<Operation> children;
    private final TypeRef type;
    private final Source source;

    public OtherOperation(String description, List<Operation> children, TypeRef type, Source source) {
        this.description = Objects.requireNonNull(description);
        this.children = List.copyOf(children);
        this.type = type;
        this.source = source;
    }

    public String description() {
        return description;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.OTHER;
    }

    @Override
    public TypeRef type() {
        return type;
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
        return description + children;
    }
}
