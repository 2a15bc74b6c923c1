package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.symbol.Parameter;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class ParameterReference implements Operation {
    private final Parameter parameter;
    private final Source source;

    public ParameterReference(Parameter parameter, Source source) {
        this.parameter = Objects.requireNonNull(parameter);
        this.source = source;
    }

    public Parameter parameter() {
        return parameter;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.PARAMETER_REFERENCE;
    }

    @Override
    public TypeRef type() {
        return parameter.type();
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
        return parameter.name();
    }
}
