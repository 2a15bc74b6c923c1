package org.dxdomain.analyzer.common.config;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable key/value snapshot of the analyzer configuration, as read from an {@code .editorconfig} file
 * or handed in by a build tool. Parsed once per session, then shared by all analyses.
 */
public final class AnalyzerConfigOptions {
    public static final AnalyzerConfigOptions EMPTY = new AnalyzerConfigOptions(Map.of());

    public static final char LIST_SEPARATOR = ';';

    private final Map<String, String> values;

    private AnalyzerConfigOptions(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static AnalyzerConfigOptions of(Map<String, String> values) {
        return new AnalyzerConfigOptions(values);
    }

    public static AnalyzerConfigOptions of(String key, String value) {
        return new AnalyzerConfigOptions(Map.of(key, value));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key)));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    /**
     * @return the trimmed, non-empty entries of a {@code ;}-separated list; empty when the key is absent
     */
    public List<String> getList(String key) {
        return get(key).map(AnalyzerConfigOptions::splitList).orElse(List.of());
    }

    public static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(String.valueOf(LIST_SEPARATOR)))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyzerConfigOptions that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AnalyzerConfigOptions" + values;
    }
}
