package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.common.type.TypeRef;
import org.dxdomain.analyzer.resultflow.ResultFlowContext;

import java.util.Objects;

public record ResultFlowContextImpl(ResultTypeResolver typeResolver,
                                    HandlerRegistry handlerRegistry) implements ResultFlowContext {

    public ResultFlowContextImpl {
        Objects.requireNonNull(typeResolver);
        Objects.requireNonNull(handlerRegistry);
    }

    @Override
    public boolean isSentinel(TypeRef type) {
        return typeResolver.isSentinel(type);
    }

    @Override
    public boolean isHandler(MethodRef method) {
        return handlerRegistry.isHandler(method);
    }

    @Override
    public boolean isTerminalizer(MethodRef method) {
        return handlerRegistry.isTerminalizer(method);
    }
}
