package org.dxdomain.analyzer.common;

import org.dxdomain.analyzer.common.symbol.MethodRef;

public class AnalyzerException extends RuntimeException {
    private final MethodRef methodRef;

    public AnalyzerException(MethodRef methodRef, Throwable throwable) {
        super("Exception analyzing " + methodRef, throwable);
        this.methodRef = methodRef;
    }

    public MethodRef getMethodRef() {
        return methodRef;
    }
}
