package org.dxdomain.analyzer.common.cfg;

import org.dxdomain.analyzer.common.operation.Operation;

import java.util.List;
import java.util.stream.Stream;

/**
 * The body of one method as an ordered sequence of basic blocks.
 * <p>
 * Any front-end can provide an implementation; analyzers depend on this interface only.
 * Implementations are immutable.
 */
public interface ControlFlowGraph {

    List<BasicBlock> blocks();

    /**
     * @return the top-level operations of all blocks, in block order; branch values are not included
     */
    default Stream<Operation> operationStream() {
        return blocks().stream().flatMap(block -> block.operations().stream());
    }

    default boolean isEmpty() {
        return blocks().stream().allMatch(block -> block.operations().isEmpty() && block.branchValue() == null);
    }
}
