package org.dxdomain.analyzer.common.type;

import java.util.Objects;

public record ArrayType(TypeRef componentType) implements TypeRef {

    public ArrayType {
        Objects.requireNonNull(componentType);
    }

    @Override
    public String displayName() {
        return componentType.displayName() + "[]";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
