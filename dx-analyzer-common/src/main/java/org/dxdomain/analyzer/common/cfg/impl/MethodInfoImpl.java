package org.dxdomain.analyzer.common.cfg.impl;

import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.symbol.MethodRef;

import java.util.Objects;

public class MethodInfoImpl implements MethodInfo {
    private final MethodRef methodRef;
    private final ControlFlowGraph controlFlowGraph;
    private final String bodyFingerprint;

    private MethodInfoImpl(MethodRef methodRef, ControlFlowGraph controlFlowGraph, String bodyFingerprint) {
        this.methodRef = Objects.requireNonNull(methodRef);
        this.controlFlowGraph = controlFlowGraph;
        this.bodyFingerprint = Objects.requireNonNull(bodyFingerprint);
    }

    public static MethodInfo of(MethodRef methodRef, ControlFlowGraph controlFlowGraph) {
        Objects.requireNonNull(controlFlowGraph);
        return new MethodInfoImpl(methodRef, controlFlowGraph, StructuralFingerprint.compute(controlFlowGraph));
    }

    public static MethodInfo withoutBody(MethodRef methodRef) {
        return new MethodInfoImpl(methodRef, null, "");
    }

    @Override
    public MethodRef methodRef() {
        return methodRef;
    }

    @Override
    public ControlFlowGraph controlFlowGraph() {
        return controlFlowGraph;
    }

    @Override
    public String bodyFingerprint() {
        return bodyFingerprint;
    }

    @Override
    public String toString() {
        return methodRef.fullyQualifiedName();
    }
}
