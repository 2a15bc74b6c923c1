package org.dxdomain.analyzer.common.type;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record NamedType(String qualifiedName, List<TypeRef> typeArguments) implements TypeRef {

    public NamedType {
        Objects.requireNonNull(qualifiedName);
        typeArguments = List.copyOf(typeArguments);
    }

    public static NamedType of(String qualifiedName, TypeRef... typeArguments) {
        return new NamedType(qualifiedName, Arrays.asList(typeArguments));
    }

    public boolean isGeneric() {
        return !typeArguments.isEmpty();
    }

    /*
    all instantiations Result<T>, Result<T, E> share the definition Result
     */
    @Override
    public NamedType originalDefinition() {
        return typeArguments.isEmpty() ? this : new NamedType(qualifiedName, List.of());
    }

    public String packageName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? "" : qualifiedName.substring(0, dot);
    }

    public String simpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    @Override
    public String displayName() {
        if (typeArguments.isEmpty()) return qualifiedName;
        return qualifiedName + typeArguments.stream().map(TypeRef::displayName)
                .collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public String toString() {
        return displayName();
    }
}
