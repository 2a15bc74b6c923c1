package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class IsPattern implements Operation {
    private final Operation value;
    private final String pattern;
    private final Source source;
    private final List<Operation> children;

    public IsPattern(Operation value, String pattern, Source source) {
        this.value = Objects.requireNonNull(value);
        this.pattern = Objects.requireNonNull(pattern);
        this.source = source;
        this.children = Children.of(value);
    }

    public Operation value() {
        return value;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.IS_PATTERN;
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
        return value + " is " + pattern;
    }
}
