package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

// value instanceof testedType
public final class IsType implements Operation {
    private final Operation value;
    private final TypeRef testedType;
    private final Source source;
    private final List<Operation> children;

    public IsType(Operation value, TypeRef testedType, Source source) {
        this.value = Objects.requireNonNull(value);
        this.testedType = Objects.requireNonNull(testedType);
        this.source = source;
        this.children = Children.of(value);
    }

    public Operation value() {
        return value;
    }

    public TypeRef testedType() {
        return testedType;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.IS_TYPE;
    }

    @Override
    public TypeRef type() {
        return PrimitiveType.BOOLEAN;
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
        return value + " instanceof " + testedType;
    }
}
