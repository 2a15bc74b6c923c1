package org.dxdomain.analyzer.common.symbol;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.Objects;

/*
Identity semantics: two locals with the same name in different scopes are different variables.
 */
public final class LocalVariable {
    private final String name;
    private final TypeRef type;

    public LocalVariable(String name, TypeRef type) {
        this.name = Objects.requireNonNull(name);
        this.type = type;
    }

    public String name() {
        return name;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
