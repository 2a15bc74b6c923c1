package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class Invocation implements Operation {
    private final MethodRef targetMethod;
    private final Operation instance;
    private final List<Operation> arguments;
    private final TypeRef type;
    private final Source source;
    private final List<Operation> children;

    public Invocation(MethodRef targetMethod, Operation instance, List<Operation> arguments, Source source) {
        this(targetMethod, instance, arguments, targetMethod.returnType(), source);
    }

    public Invocation(MethodRef targetMethod, Operation instance, List<Operation> arguments, TypeRef type,
                      Source source) {
        this.targetMethod = Objects.requireNonNull(targetMethod);
        this.instance = instance;
        this.arguments = List.copyOf(arguments);
        this.type = type;
        this.source = source;
        this.children = Children.of(instance, this.arguments);
    }

    public MethodRef targetMethod() {
        return targetMethod;
    }

    // null for static methods
    public Operation instance() {
        return instance;
    }

    public List<Operation> arguments() {
        return arguments;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.INVOCATION;
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
        return (instance == null ? targetMethod.declaringType().simpleName() : instance.toString())
               + "." + targetMethod.name() + "(" + arguments.size() + ")";
    }
}
