package org.dxdomain.analyzer.rules;

import java.util.Objects;

public record DiagnosticDescriptor(String id,
                                   String title,
                                   String messageFormat,
                                   String category,
                                   Severity defaultSeverity,
                                   boolean enabledByDefault,
                                   String description) {

    public DiagnosticDescriptor {
        Objects.requireNonNull(id);
        Objects.requireNonNull(title);
        Objects.requireNonNull(messageFormat);
        Objects.requireNonNull(defaultSeverity);
    }
}
