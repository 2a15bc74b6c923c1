package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.symbol.MethodRef;

import java.util.HashSet;
import java.util.Set;

/*
Two independent name sets, parsed from configuration strings of the form

    a.b.Results.match;a.b.Log.consume

Entries without a separating dot, or with the dot in the first or last position, are skipped.
Lookup is exact on (display name of the declaring type, member name).
Nothing prevents a method from being in both sets.
 */
public class HandlerRegistry {
    public static final HandlerRegistry EMPTY = new HandlerRegistry(Set.of(), Set.of());

    public record HandlerKey(String containingType, String methodName) {
        public static HandlerKey of(MethodRef methodRef) {
            return new HandlerKey(methodRef.declaringType().displayName(), methodRef.name());
        }

        @Override
        public String toString() {
            return containingType + "." + methodName;
        }
    }

    private final Set<HandlerKey> handlers;
    private final Set<HandlerKey> terminalizers;

    public HandlerRegistry(Set<HandlerKey> handlers, Set<HandlerKey> terminalizers) {
        this.handlers = Set.copyOf(handlers);
        this.terminalizers = Set.copyOf(terminalizers);
    }

    public static HandlerRegistry from(AnalyzerConfigOptions options, String handlerKey, String terminalizerKey) {
        return new HandlerRegistry(parse(options.get(handlerKey).orElse("")),
                parse(options.get(terminalizerKey).orElse("")));
    }

    public static Set<HandlerKey> parse(String raw) {
        if (raw == null || raw.isBlank()) return Set.of();
        Set<HandlerKey> set = new HashSet<>();
        for (String entry : AnalyzerConfigOptions.splitList(raw)) {
            int lastDot = entry.lastIndexOf('.');
            if (lastDot <= 0 || lastDot == entry.length() - 1) continue;
            set.add(new HandlerKey(entry.substring(0, lastDot), entry.substring(lastDot + 1)));
        }
        return Set.copyOf(set);
    }

    public boolean isHandler(MethodRef method) {
        return !handlers.isEmpty() && handlers.contains(HandlerKey.of(method));
    }

    public boolean isTerminalizer(MethodRef method) {
        return !terminalizers.isEmpty() && terminalizers.contains(HandlerKey.of(method));
    }

    public Set<HandlerKey> handlers() {
        return handlers;
    }

    public Set<HandlerKey> terminalizers() {
        return terminalizers;
    }
}
