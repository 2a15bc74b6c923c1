package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.CancellationToken;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.resultflow.ResultFlowContext;
import org.dxdomain.analyzer.resultflow.ResultFlowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/*
Caches one flow graph per (method, structural fingerprint of its body, context), so that several rules
asking about the same method in one pass share the analysis. The fingerprint covers source positions,
so a changed or moved body is a new key, and so is an overload at another location.
A hit may still hand out the producer operations of an earlier, structurally identical MethodInfo;
their kinds, types and positions are the same.

Contexts are cached per (type oracle, options): callers going through the convenience method
share one context, and therefore the flow graphs.

Neither cache is ever evicted: one instance lives for one analysis session (AnalyzerServices.create
builds a new one each time). Long-lived callers must call clear() between sessions.
 */
public class CachingResultFlowEngine implements ResultFlowEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(CachingResultFlowEngine.class);

    private record Key(String declaringType, String methodName, String fingerprint, ResultFlowContext context) {
    }

    private record ContextKey(TypeOracle typeOracle, AnalyzerConfigOptions options) {
    }

    private final ResultFlowEngine delegate;
    private final Map<Key, FlowGraph> cache = new ConcurrentHashMap<>();
    private final Map<ContextKey, ResultFlowContext> contexts = new ConcurrentHashMap<>();

    public CachingResultFlowEngine(ResultFlowEngine delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public ResultFlowContext createContext(TypeOracle typeOracle, AnalyzerConfigOptions options) {
        return contexts.computeIfAbsent(new ContextKey(typeOracle, options),
                k -> delegate.createContext(k.typeOracle, k.options));
    }

    @Override
    public FlowGraph analyze(MethodInfo methodInfo, ResultFlowContext context, CancellationToken cancellationToken) {
        Objects.requireNonNull(methodInfo);
        Objects.requireNonNull(context);
        Objects.requireNonNull(cancellationToken);
        cancellationToken.throwIfCancellationRequested();
        Key key = new Key(methodInfo.methodRef().declaringType().displayName(), methodInfo.methodRef().name(),
                methodInfo.bodyFingerprint(), context);
        FlowGraph cached = cache.get(key);
        if (cached != null) {
            LOGGER.debug("Cache hit for {}", methodInfo);
            return cached;
        }
        return cache.computeIfAbsent(key, k -> delegate.analyze(methodInfo, context, cancellationToken));
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        contexts.clear();
    }
}
