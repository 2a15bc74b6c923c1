package org.dxdomain.analyzer.common;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/*
Cooperative cancellation, handed in by the caller of an analysis.
Analyzers check it where they choose to; a request is never retracted.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Analysis cancelled");
        }
    }

    static Signal signal() {
        return new Signal();
    }

    class Signal {
        private final AtomicBoolean cancelled = new AtomicBoolean();

        public void cancel() {
            cancelled.set(true);
        }

        public CancellationToken token() {
            return cancelled::get;
        }
    }
}
