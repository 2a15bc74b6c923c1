package org.dxdomain.analyzer.common.symbol;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.Objects;

public final class Parameter {
    private final String name;
    private final int index;
    private final TypeRef type;

    public Parameter(String name, int index, TypeRef type) {
        this.name = Objects.requireNonNull(name);
        this.index = index;
        this.type = type;
    }

    public String name() {
        return name;
    }

    public int index() {
        return index;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    public String toString() {
        return name + "#" + index;
    }
}
