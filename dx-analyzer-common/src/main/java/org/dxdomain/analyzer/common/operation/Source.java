package org.dxdomain.analyzer.common.operation;

public record Source(String path, int line, int column) {

    public static Source at(int line, int column) {
        return new Source(null, line, column);
    }

    public String compact() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return path == null ? compact() : path + ":" + compact();
    }
}
