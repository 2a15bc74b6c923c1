package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;

public final class Return implements Operation {
    private final Operation returnedValue;
    private final Source source;
    private final List<Operation> children;

    public Return(Operation returnedValue, Source source) {
        this.returnedValue = returnedValue;
        this.source = source;
        this.children = Children.of(returnedValue);
    }

    // null in a void method
    public Operation returnedValue() {
        return returnedValue;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.RETURN;
    }

    @Override
    public TypeRef type() {
        return null;
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
        return returnedValue == null ? "return" : "return " + returnedValue;
    }
}
