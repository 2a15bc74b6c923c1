package org.dxdomain.analyzer.common.cfg;

import org.dxdomain.analyzer.common.symbol.MethodRef;

/**
 * The unit of analysis: one method with, where available, its control-flow graph.
 */
public interface MethodInfo {

    MethodRef methodRef();

    /**
     * @return the control-flow graph of the body, or null when the method has no block-form body
     * (abstract and native methods, expression-bodied members the front-end cannot lower, ...)
     */
    ControlFlowGraph controlFlowGraph();

    /**
     * @return a structural fingerprint of the body: equal for structurally equal bodies, stable across runs.
     * Empty when there is no body.
     */
    String bodyFingerprint();

    default boolean hasBody() {
        return controlFlowGraph() != null;
    }
}
