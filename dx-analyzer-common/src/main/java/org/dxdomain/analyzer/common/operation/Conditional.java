package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

/*
condition ? whenTrue : whenFalse, or an if-statement when whenFalse is absent and the type is null
 */
public final class Conditional implements Operation {
    private final Operation condition;
    private final Operation whenTrue;
    private final Operation whenFalse;
    private final TypeRef type;
    private final Source source;
    private final List<Operation> children;

    public Conditional(Operation condition, Operation whenTrue, Operation whenFalse, TypeRef type, Source source) {
        this.condition = Objects.requireNonNull(condition);
        this.whenTrue = Objects.requireNonNull(whenTrue);
        this.whenFalse = whenFalse;
        this.type = type;
        this.source = source;
        this.children = Children.of(condition, whenTrue, whenFalse);
    }

    public Operation condition() {
        return condition;
    }

    public Operation whenTrue() {
        return whenTrue;
    }

    public Operation whenFalse() {
        return whenFalse;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CONDITIONAL;
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
        return condition + " ? " + whenTrue + " : " + whenFalse;
    }
}
