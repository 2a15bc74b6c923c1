package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.Objects;

/*
read of a property or field: instance.member
 */
public final class MemberReference implements Operation {
    private final Operation instance;
    private final String memberName;
    private final TypeRef type;
    private final Source source;
    private final List<Operation> children;

    public MemberReference(Operation instance, String memberName, TypeRef type, Source source) {
        this.instance = instance;
        this.memberName = Objects.requireNonNull(memberName);
        this.type = type;
        this.source = source;
        this.children = Children.of(instance);
    }

    // null for static members
    public Operation instance() {
        return instance;
    }

    public String memberName() {
        return memberName;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.MEMBER_REFERENCE;
    }

    @Override
    public TypeRef type() {
        return type;
    }

    @Override
    public List<Operation> children() {
        return children;
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public String toString() {
        return (instance == null ? "" : instance + ".") + memberName;
    }
}
