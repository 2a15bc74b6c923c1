package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.operation.Operation;
import org.dxdomain.analyzer.resultflow.FlowDiagnostic;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.resultflow.ResultNode;
import org.dxdomain.analyzer.resultflow.ResultState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/*
Bookkeeping of one analysis run. Not thread-safe; never shared between runs.

Producers are keyed on operation identity: two equal-looking expressions are two nodes.
 */
class NodeTable {
    private final Map<Operation, ResultNode> producerToNode = new IdentityHashMap<>();
    private final List<ResultNode> nodes = new ArrayList<>();
    private final Map<ResultNode, ResultState> states = new HashMap<>();
    private boolean frozen;

    ResultNode register(Operation producer) {
        assert !frozen;
        ResultNode existing = producerToNode.get(producer);
        if (existing != null) return existing;
        ResultNode node = new ResultNode(nodes.size(), producer, Objects.requireNonNull(producer.type()));
        nodes.add(node);
        producerToNode.put(producer, node);
        states.put(node, ResultState.CREATED);
        return node;
    }

    ResultNode lookup(Operation operation) {
        return producerToNode.get(operation);
    }

    ResultState state(ResultNode node) {
        ResultState state = states.get(node);
        if (state == null) throw new IllegalArgumentException("Node not in table: " + node);
        return state;
    }

    /*
    monotonic: a request at or below the current state is a no-op
     */
    boolean promote(ResultNode node, ResultState newState) {
        if (!newState.isPromotion()) {
            throw new IllegalArgumentException("Cannot promote to " + newState);
        }
        assert !frozen;
        ResultState current = state(node);
        if (!current.canBePromotedTo(newState)) return false;
        states.put(node, newState);
        return true;
    }

    int size() {
        return nodes.size();
    }

    List<ResultNode> nodes() {
        return List.copyOf(nodes);
    }

    FlowGraph freeze(List<FlowDiagnostic> diagnostics) {
        frozen = true;
        Map<ResultNode, ResultState> finalStates = new HashMap<>();
        for (ResultNode node : nodes) {
            finalStates.put(node, states.get(node).finalState());
        }
        return new FlowGraph(nodes, finalStates, diagnostics, true);
    }
}
