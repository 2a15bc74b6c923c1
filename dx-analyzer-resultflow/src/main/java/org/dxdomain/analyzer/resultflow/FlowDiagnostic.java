package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.operation.Operation;

import java.util.Objects;

/**
 * A note produced during one analysis run. Notes do not change the state of any node.
 *
 * @param kind      what kind of note
 * @param message   human-readable description
 * @param operation the operation the note refers to; null when the note is about the method as a whole
 * @param node      the tracked node the note refers to; may be null
 */
public record FlowDiagnostic(Kind kind, String message, Operation operation, ResultNode node) {

    public enum Kind {
        // the method could not be analyzed; the only note of an invalid flow graph
        NO_ANALYZABLE_BODY,
        // a tracked value was passed to a method that is neither a handler nor a terminalizer
        UNCONFIGURED_CALL,
        // the invoked method is configured both as handler and as terminalizer
        HANDLER_TERMINALIZER_OVERLAP
    }

    public FlowDiagnostic {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(message);
    }

    public FlowDiagnostic(Kind kind, String message) {
        this(kind, message, null, null);
    }
}
