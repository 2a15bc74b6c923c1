package org.dxdomain.analyzer.common.type;

public record PrimitiveType(String name) implements TypeRef {
    public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");
    public static final PrimitiveType INT = new PrimitiveType("int");
    public static final PrimitiveType VOID = new PrimitiveType("void");

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
