package org.dxdomain.analyzer.rules;

import org.dxdomain.analyzer.common.CancellationToken;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.dxdomain.analyzer.resultflow.ResultFlowContext;
import org.dxdomain.analyzer.resultflow.ResultFlowEngine;
import org.dxdomain.analyzer.resultflow.impl.CachingResultFlowEngine;
import org.dxdomain.analyzer.resultflow.impl.ResultFlowEngineImpl;
import org.dxdomain.analyzer.rules.scope.ScopeResolver;

import java.util.Objects;

/*
Everything a rule needs, built once per compilation and configuration and shared by all rules.
 */
public record AnalyzerServices(ResultFlowEngine flowEngine,
                               ResultFlowContext flowContext,
                               ScopeResolver scopeResolver,
                               AnalyzerConfigOptions options,
                               CancellationToken cancellationToken) {

    public AnalyzerServices {
        Objects.requireNonNull(flowEngine);
        Objects.requireNonNull(flowContext);
        Objects.requireNonNull(scopeResolver);
        Objects.requireNonNull(options);
        Objects.requireNonNull(cancellationToken);
    }

    public static AnalyzerServices create(TypeOracle typeOracle, AnalyzerConfigOptions options) {
        return create(new ResultFlowEngineImpl(), typeOracle, options, CancellationToken.NONE);
    }

    public static AnalyzerServices create(ResultFlowEngine engine,
                                          TypeOracle typeOracle,
                                          AnalyzerConfigOptions options,
                                          CancellationToken cancellationToken) {
        ResultFlowEngine caching = engine instanceof CachingResultFlowEngine ? engine : new CachingResultFlowEngine(engine);
        return new AnalyzerServices(caching, caching.createContext(typeOracle, options), ScopeResolver.from(options),
                options, cancellationToken);
    }
}
