package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.symbol.LocalVariable;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

public final class LocalReference implements Operation {
    private final LocalVariable local;
    private final Source source;

    public LocalReference(LocalVariable local, Source source) {
        this.local = Objects.requireNonNull(local);
        this.source = source;
    }

    public LocalVariable local() {
        return local;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.LOCAL_REFERENCE;
    }

    @Override
    public TypeRef type() {
        return local.type();
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
        return local.name();
    }
}
