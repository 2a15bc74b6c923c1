package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;

public final class Literal implements Operation {
    private final String text;
    private final TypeRef type;
    private final Source source;

    public Literal(String text, TypeRef type, Source source) {
        this.text = text;
        this.type = type;
        this.source = source;
    }

    public String text() {
        return text;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.LITERAL;
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
        return text;
    }
}
