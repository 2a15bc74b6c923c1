package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class ObjectCreation implements Operation {
    private final TypeRef type;
    private final List<Operation> arguments;
    private final Source source;

    public ObjectCreation(TypeRef type, List<Operation> arguments, Source source) {
        this.type = Objects.requireNonNull(type);
        this.arguments = List.copyOf(arguments);
        this.source = source;
    }

    public List<Operation> arguments() {
        return arguments;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.OBJECT_CREATION;
    }

    @Override
    public TypeRef type() {
        return type;
    }

    @Override
    public List<Operation> children() {
        return arguments;
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public String toString() {
        return "new " + type.displayName() + "(" + arguments.size() + ")";
    }
}
