package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.cfg.BasicBlock;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.LocalVariable;
import org.dxdomain.analyzer.common.symbol.Parameter;
import org.dxdomain.analyzer.resultflow.ResultNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/*
Traces a value expression back to the node that produced it, in this order:

1. the expression is itself a registered producer;
2. a local read: the first simple assignment to that local, anywhere in the method, whose value resolves;
3. a parameter read: a simple assignment copying the parameter into a local, resolved as in 2;
4. a conversion or parenthesized expression: unwrap one layer and start again.

Anything else does not resolve: values stored in fields, passed through out-parameters, or carried over
a loop back-edge stay unresolved. There is no fixed-point computation and no merging at join points.
 */
class AliasResolver {
    private final NodeTable nodeTable;
    private final List<SimpleAssignment> assignments;

    AliasResolver(ControlFlowGraph controlFlowGraph, NodeTable nodeTable) {
        this.nodeTable = nodeTable;
        this.assignments = collectAssignments(controlFlowGraph);
    }

    private static List<SimpleAssignment> collectAssignments(ControlFlowGraph controlFlowGraph) {
        List<SimpleAssignment> list = new ArrayList<>();
        for (BasicBlock block : controlFlowGraph.blocks()) {
            for (Operation operation : block.operations()) {
                collectAssignments(operation, list);
            }
            if (block.branchValue() != null) {
                collectAssignments(block.branchValue(), list);
            }
        }
        return List.copyOf(list);
    }

    private static void collectAssignments(Operation operation, List<SimpleAssignment> list) {
        operation.visit(o -> {
            if (o instanceof SimpleAssignment assignment) list.add(assignment);
            return true;
        });
    }

    ResultNode resolve(Operation value) {
        return resolve(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    // 'visiting' breaks cycles such as a = b; b = a;
    private ResultNode resolve(Operation value, Set<Object> visiting) {
        if (value == null) return null;
        ResultNode direct = nodeTable.lookup(value);
        if (direct != null) return direct;
        if (value instanceof LocalReference localReference) {
            return throughLocal(localReference.local(), visiting);
        }
        if (value instanceof ParameterReference parameterReference) {
            return throughParameter(parameterReference.parameter(), visiting);
        }
        if (value instanceof Conversion conversion) {
            return resolve(conversion.operand(), visiting);
        }
        if (value instanceof Parenthesized parenthesized) {
            return resolve(parenthesized.operand(), visiting);
        }
        return null;
    }

    private ResultNode throughLocal(LocalVariable local, Set<Object> visiting) {
        if (!visiting.add(local)) return null;
        try {
            for (SimpleAssignment assignment : assignments) {
                if (assignment.target() instanceof LocalReference target && target.local() == local) {
                    ResultNode node = resolve(assignment.value(), visiting);
                    if (node != null) return node;
                }
            }
            return null;
        } finally {
            visiting.remove(local);
        }
    }

    private ResultNode throughParameter(Parameter parameter, Set<Object> visiting) {
        if (!visiting.add(parameter)) return null;
        try {
            Set<LocalVariable> copies = new HashSet<>();
            for (SimpleAssignment assignment : assignments) {
                if (assignment.value() instanceof ParameterReference source && source.parameter() == parameter
                    && assignment.target() instanceof LocalReference target && copies.add(target.local())) {
                    ResultNode node = throughLocal(target.local(), visiting);
                    if (node != null) return node;
                }
            }
            return null;
        } finally {
            visiting.remove(parameter);
        }
    }
}
