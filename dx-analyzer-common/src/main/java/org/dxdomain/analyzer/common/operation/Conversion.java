package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

// explicit cast or implicit conversion inserted by the front-end
public final class Conversion implements Operation {
    private final Operation operand;
    private final TypeRef type;
    private final Source source;
    private final List<Operation> children;

    public Conversion(Operation operand, TypeRef type, Source source) {
        this.operand = Objects.requireNonNull(operand);
        this.type = type;
        this.source = source;
        this.children = Children.of(operand);
    }

    public Operation operand() {
        return operand;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CONVERSION;
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
        return "(" + (type == null ? "?" : type.displayName()) + ") " + operand;
    }
}
