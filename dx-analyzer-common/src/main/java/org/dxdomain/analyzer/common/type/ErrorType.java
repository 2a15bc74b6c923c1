package org.dxdomain.analyzer.common.type;

// a type the front-end could not resolve; it keeps the name as written in the source
public record ErrorType(String name) implements TypeRef {

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public boolean isError() {
        return true;
    }

    @Override
    public String toString() {
        return "?" + name;
    }
}
