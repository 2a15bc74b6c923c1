package org.dxdomain.analyzer.common.type;

/**
 * Static type of an operation, as reported by the front-end.
 * <p>
 * Types are values: two references to {@code a.b.Result<String>} are equal.
 */
public sealed interface TypeRef permits NamedType, ArrayType, PrimitiveType, ErrorType {

    /**
     * @return the fully qualified name, including type arguments where present
     */
    String displayName();

    /**
     * @return the unparameterized definition of this type; for most types, the type itself
     */
    default TypeRef originalDefinition() {
        return this;
    }

    /**
     * @return true when the front-end could not resolve the type
     */
    default boolean isError() {
        return false;
    }
}
