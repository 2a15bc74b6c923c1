package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.CancellationToken;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.TypeOracle;

import java.util.Set;

/**
 * Tracks every value of the sentinel result type through one method body, and classifies each as
 * checked, propagated, terminated or ignored.
 * <p>
 * Implementations hold no mutable state across calls, and can be called concurrently for different methods.
 */
public interface ResultFlowEngine {

    interface Configuration {

        // fully qualified names of the sentinel result types, without type arguments
        Set<String> resultTypeNames();

        // configuration key of the ';'-separated list of handlers, as Type.member
        String handlerConfigKey();

        // configuration key of the ';'-separated list of terminalizers, as Type.member
        String terminalizerConfigKey();
    }

    ResultFlowContext createContext(TypeOracle typeOracle, AnalyzerConfigOptions options);

    /**
     * Cancellation is honored on entry only.
     *
     * @return a finalized flow graph; invalid when the method has no analyzable body
     */
    FlowGraph analyze(MethodInfo methodInfo, ResultFlowContext context, CancellationToken cancellationToken);

    default FlowGraph analyze(MethodInfo methodInfo, TypeOracle typeOracle, AnalyzerConfigOptions options) {
        return analyze(methodInfo, createContext(typeOracle, options), CancellationToken.NONE);
    }
}
