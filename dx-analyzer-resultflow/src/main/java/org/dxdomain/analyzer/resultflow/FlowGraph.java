package org.dxdomain.analyzer.resultflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of analyzing one method.
 * <p>
 * When {@link #valid()} is false, the analysis could not run and the graph carries no nodes.
 * Consumers must read this as <em>inconclusive</em>, never as "no problems found".
 */
public final class FlowGraph {
    private final List<ResultNode> nodes;
    private final Map<ResultNode, ResultState> nodeStates;
    private final List<FlowDiagnostic> diagnostics;
    private final boolean valid;

    public FlowGraph(List<ResultNode> nodes,
                     Map<ResultNode, ResultState> nodeStates,
                     List<FlowDiagnostic> diagnostics,
                     boolean valid) {
        this.nodes = List.copyOf(nodes);
        this.diagnostics = List.copyOf(diagnostics);
        this.valid = valid;
        Map<ResultNode, ResultState> copy = new LinkedHashMap<>();
        for (ResultNode node : this.nodes) {
            ResultState state = nodeStates.get(node);
            if (state == null) {
                throw new IllegalArgumentException("No state for " + node);
            }
            if (state == ResultState.CREATED) {
                throw new IllegalArgumentException("Node " + node + " has not been finalized");
            }
            copy.put(node, state);
        }
        if (copy.size() != nodeStates.size()) {
            throw new IllegalArgumentException("States for nodes not in the graph");
        }
        this.nodeStates = Collections.unmodifiableMap(copy);
    }

    public static FlowGraph invalid(FlowDiagnostic reason) {
        return new FlowGraph(List.of(), Map.of(), List.of(Objects.requireNonNull(reason)), false);
    }

    // in discovery order
    public List<ResultNode> nodes() {
        return nodes;
    }

    public Map<ResultNode, ResultState> nodeStates() {
        return nodeStates;
    }

    public ResultState state(ResultNode node) {
        ResultState state = nodeStates.get(node);
        if (state == null) throw new IllegalArgumentException("Unknown node " + node);
        return state;
    }

    public List<ResultNode> nodesWithState(ResultState state) {
        return nodes.stream().filter(n -> nodeStates.get(n) == state).toList();
    }

    public List<FlowDiagnostic> diagnostics() {
        return diagnostics;
    }

    public List<FlowDiagnostic> diagnostics(FlowDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    public boolean valid() {
        return valid;
    }

    @Override
    public String toString() {
        return valid ? "FlowGraph" + nodeStates : "FlowGraph[invalid: " + diagnostics + "]";
    }
}
