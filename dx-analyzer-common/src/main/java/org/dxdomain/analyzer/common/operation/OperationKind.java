package org.dxdomain.analyzer.common.operation;

public enum OperationKind {
    INVOCATION,
    OBJECT_CREATION,
    MEMBER_REFERENCE,
    SIMPLE_ASSIGNMENT,
    RETURN,
    CONDITIONAL,
    CONDITIONAL_ACCESS,
    CONDITIONAL_ACCESS_INSTANCE,
    IS_PATTERN,
    IS_TYPE,
    CONVERSION,
    PARENTHESIZED,
    LOCAL_REFERENCE,
    PARAMETER_REFERENCE,
    LITERAL,
    OTHER
}
