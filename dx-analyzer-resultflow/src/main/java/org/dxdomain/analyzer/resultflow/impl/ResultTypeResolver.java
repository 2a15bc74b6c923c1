package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.type.NamedType;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.dxdomain.analyzer.common.type.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/*
Decides whether a type is one of the sentinel result types.

The configured names are resolved against the compilation once, at construction; names the compilation
does not know are dropped. A type matches when its generic definition is one of the resolved definitions,
so that 'Result' covers Result<T> and Result<T, E>.
 */
public class ResultTypeResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultTypeResolver.class);

    private final Set<NamedType> resultTypeDefinitions;

    public ResultTypeResolver(TypeOracle typeOracle, Collection<String> resultTypeNames) {
        Set<NamedType> set = new HashSet<>();
        for (String name : resultTypeNames) {
            NamedType definition = typeOracle.typeDefinition(name);
            if (definition != null) {
                set.add(definition.originalDefinition());
            } else {
                LOGGER.debug("Result type {} not present in compilation", name);
            }
        }
        this.resultTypeDefinitions = Set.copyOf(set);
    }

    public boolean isSentinel(TypeRef type) {
        if (type == null || type.isError()) return false;
        if (!(type instanceof NamedType named)) return false;
        return resultTypeDefinitions.contains(named.originalDefinition());
    }

    public Set<NamedType> resultTypeDefinitions() {
        return resultTypeDefinitions;
    }
}
