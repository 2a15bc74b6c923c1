package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class Parenthesized implements Operation {
    private final Operation operand;
    private final Source source;
    private final List<Operation> children;

    public Parenthesized(Operation operand, Source source) {
        this.operand = Objects.requireNonNull(operand);
        this.source = source;
        this.children = Children.of(operand);
    }

    public Operation operand() {
        return operand;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.PARENTHESIZED;
    }

    @Override
    public TypeRef type() {
        return operand.type();
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
        return "(" + operand + ")";
    }
}
