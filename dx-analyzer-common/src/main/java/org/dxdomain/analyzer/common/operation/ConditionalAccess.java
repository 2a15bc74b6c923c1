package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

/*
instance?.access; inside 'whenNotNull', the instance is represented by a ConditionalAccessInstance
 */
public final class ConditionalAccess implements Operation {
    private final Operation instance;
    private final Operation whenNotNull;
    private final Source source;
    private final List<Operation> children;

    public ConditionalAccess(Operation instance, Operation whenNotNull, Source source) {
        this.instance = Objects.requireNonNull(instance);
        this.whenNotNull = Objects.requireNonNull(whenNotNull);
        this.source = source;
        this.children = Children.of(instance, whenNotNull);
    }

    public Operation instance() {
        return instance;
    }

    public Operation whenNotNull() {
        return whenNotNull;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CONDITIONAL_ACCESS;
    }

    @Override
    public TypeRef type() {
        return whenNotNull.type();
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
        return instance + "?." + whenNotNull;
    }
}
