package org.dxdomain.analyzer.rules;

import org.dxdomain.analyzer.common.operation.Source;
import org.dxdomain.analyzer.common.symbol.MethodRef;

import java.util.Objects;

/**
 * One user-facing diagnostic.
 *
 * @param descriptor the rule that produced it
 * @param method     the method in which the problem occurs
 * @param source     location of the offending expression; null when the front-end gave none
 * @param message    the formatted message
 */
public record Finding(DiagnosticDescriptor descriptor, MethodRef method, Source source, String message) {

    public Finding {
        Objects.requireNonNull(descriptor);
        Objects.requireNonNull(method);
        Objects.requireNonNull(message);
    }

    public String id() {
        return descriptor.id();
    }

    public Severity severity() {
        return descriptor.defaultSeverity();
    }

    @Override
    public String toString() {
        return descriptor.id() + " " + method + (source == null ? "" : " @" + source) + ": " + message;
    }
}
