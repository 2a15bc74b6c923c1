package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.AnalyzerException;
import org.dxdomain.analyzer.common.CancellationToken;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.dxdomain.analyzer.resultflow.FlowDiagnostic;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.resultflow.ResultFlowContext;
import org.dxdomain.analyzer.resultflow.ResultFlowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public class ResultFlowEngineImpl implements ResultFlowEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultFlowEngineImpl.class);

    public static final String DEFAULT_RESULT_TYPE = "org.dxdomain.Result";
    public static final String DEFAULT_HANDLER_KEY = "dx.result.handlers";
    public static final String DEFAULT_TERMINALIZER_KEY = "dx.result.terminalizers";

    private final Configuration configuration;

    public ResultFlowEngineImpl() {
        this(new ConfigurationBuilder().build());
    }

    public ResultFlowEngineImpl(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration);
    }

    public record ConfigurationImpl(Set<String> resultTypeNames,
                                    String handlerConfigKey,
                                    String terminalizerConfigKey) implements Configuration {
    }

    public static class ConfigurationBuilder {
        private final Set<String> resultTypeNames = new LinkedHashSet<>();
        private String handlerConfigKey = DEFAULT_HANDLER_KEY;
        private String terminalizerConfigKey = DEFAULT_TERMINALIZER_KEY;

        public ConfigurationBuilder addResultTypeName(String resultTypeName) {
            this.resultTypeNames.add(resultTypeName);
            return this;
        }

        public ConfigurationBuilder setHandlerConfigKey(String handlerConfigKey) {
            this.handlerConfigKey = handlerConfigKey;
            return this;
        }

        public ConfigurationBuilder setTerminalizerConfigKey(String terminalizerConfigKey) {
            this.terminalizerConfigKey = terminalizerConfigKey;
            return this;
        }

        public Configuration build() {
            Set<String> names = resultTypeNames.isEmpty() ? Set.of(DEFAULT_RESULT_TYPE) : Set.copyOf(resultTypeNames);
            return new ConfigurationImpl(names, handlerConfigKey, terminalizerConfigKey);
        }
    }

    public Configuration configuration() {
        return configuration;
    }

    @Override
    public ResultFlowContext createContext(TypeOracle typeOracle, AnalyzerConfigOptions options) {
        Objects.requireNonNull(typeOracle);
        Objects.requireNonNull(options);
        ResultTypeResolver typeResolver = new ResultTypeResolver(typeOracle, configuration.resultTypeNames());
        HandlerRegistry handlerRegistry = HandlerRegistry.from(options, configuration.handlerConfigKey(),
                configuration.terminalizerConfigKey());
        LOGGER.debug("Created context: {} result types, {} handlers, {} terminalizers",
                typeResolver.resultTypeDefinitions().size(), handlerRegistry.handlers().size(),
                handlerRegistry.terminalizers().size());
        return new ResultFlowContextImpl(typeResolver, handlerRegistry);
    }

    @Override
    public FlowGraph analyze(MethodInfo methodInfo, ResultFlowContext context, CancellationToken cancellationToken) {
        Objects.requireNonNull(methodInfo);
        Objects.requireNonNull(context);
        Objects.requireNonNull(cancellationToken);
        cancellationToken.throwIfCancellationRequested();

        ControlFlowGraph cfg = methodInfo.controlFlowGraph();
        if (cfg == null) {
            LOGGER.debug("No analyzable body in {}", methodInfo);
            return FlowGraph.invalid(new FlowDiagnostic(FlowDiagnostic.Kind.NO_ANALYZABLE_BODY,
                    "Method " + methodInfo.methodRef() + " has no analyzable body"));
        }
        try {
            return new MethodFlowAnalyzer(methodInfo, cfg, context).run();
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception analyzing result flow of {}", methodInfo, re);
            throw new AnalyzerException(methodInfo.methodRef(), re);
        }
    }
}
