package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.common.type.TypeRef;

/**
 * Immutable configuration snapshot: which types are tracked, which methods forward or end the obligation.
 * Built once per compilation and configuration, then shared by all analyses, possibly from several threads.
 */
public interface ResultFlowContext {

    boolean isSentinel(TypeRef type);

    boolean isHandler(MethodRef method);

    boolean isTerminalizer(MethodRef method);
}
