package org.dxdomain.analyzer.common.type;

/*
The semantic side of the front-end: which types exist in the compilation.
 */
@FunctionalInterface
public interface TypeOracle {

    /**
     * @param qualifiedName fully qualified name, without type arguments
     * @return the definition of the type, or null when the compilation does not know it
     */
    NamedType typeDefinition(String qualifiedName);
}
