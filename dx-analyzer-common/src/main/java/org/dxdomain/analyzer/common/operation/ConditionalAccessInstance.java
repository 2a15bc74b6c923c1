package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;

public final class ConditionalAccessInstance implements Operation {
    private final TypeRef type;
    private final Source source;

    public ConditionalAccessInstance(TypeRef type, Source source) {
        this.type = type;
        this.source = source;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CONDITIONAL_ACCESS_INSTANCE;
    }

    @Override
    public TypeRef type() {
        return type;
    }

    @Override
    public List<Operation> children() {
        return List.of();
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public String toString() {
        return "<instance>";
    }
}
