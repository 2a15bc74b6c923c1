package org.dxdomain.analyzer.common.type;

import java.util.HashMap;
import java.util.Map;

public class MapTypeOracle implements TypeOracle {
    private final Map<String, NamedType> definitions;

    private MapTypeOracle(Map<String, NamedType> definitions) {
        this.definitions = Map.copyOf(definitions);
    }

    public static MapTypeOracle of(NamedType... types) {
        Builder builder = new Builder();
        for (NamedType type : types) {
            builder.add(type);
        }
        return builder.build();
    }

    @Override
    public NamedType typeDefinition(String qualifiedName) {
        return definitions.get(qualifiedName);
    }

    public static class Builder {
        private final Map<String, NamedType> definitions = new HashMap<>();

        public Builder add(NamedType type) {
            NamedType definition = type.originalDefinition();
            definitions.put(definition.qualifiedName(), definition);
            return this;
        }

        public MapTypeOracle build() {
            return new MapTypeOracle(definitions);
        }
    }
}
