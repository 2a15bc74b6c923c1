package org.dxdomain.analyzer.common.symbol;

import org.dxdomain.analyzer.common.type.NamedType;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.Objects;

/**
 * A method as seen from a call site or a declaration.
 *
 * @param declaringType the type declaring the method
 * @param name          simple name of the method; {@code <init>} for constructors
 * @param returnType    declared return type; may be null when unknown
 */
public record MethodRef(NamedType declaringType, String name, TypeRef returnType) {

    public MethodRef {
        Objects.requireNonNull(declaringType);
        Objects.requireNonNull(name);
    }

    public String fullyQualifiedName() {
        return declaringType.displayName() + "." + name;
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
