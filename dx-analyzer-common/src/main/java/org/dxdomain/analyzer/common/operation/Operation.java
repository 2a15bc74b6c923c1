package org.dxdomain.analyzer.common.operation;

import org.dxdomain.analyzer.common.type.TypeRef;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * A node in the expression tree of one operation of a basic block.
 * <p>
 * Operations have reference identity. Two operations that print the same are still two operations;
 * analyzers key their tables on the instance, never on a structural equality.
 * The hierarchy is closed: dispatch on {@link #kind()} with an exhaustive switch.
 */
public sealed interface Operation permits Invocation, ObjectCreation, MemberReference, SimpleAssignment, Return,
        Conditional, ConditionalAccess, ConditionalAccessInstance, IsPattern, IsType, Conversion, Parenthesized,
        LocalReference, ParameterReference, Literal, OtherOperation {

    OperationKind kind();

    /**
     * @return the static type of the value this operation produces, or null when it produces none
     */
    TypeRef type();

    /**
     * @return the direct sub-expressions, in source order
     */
    List<Operation> children();

    /**
     * @return the location in the source, or null for synthetic operations
     */
    Source source();

    /**
     * Depth-first, pre-order. The children of an operation are only visited when the predicate returns true.
     */
    default void visit(Predicate<Operation> predicate) {
        if (predicate.test(this)) {
            for (Operation child : children()) {
                child.visit(predicate);
            }
        }
    }

    default Stream<Operation> descendants() {
        return children().stream().flatMap(Operation::descendantsAndSelf);
    }

    default Stream<Operation> descendantsAndSelf() {
        return Stream.concat(Stream.of(this), descendants());
    }
}
