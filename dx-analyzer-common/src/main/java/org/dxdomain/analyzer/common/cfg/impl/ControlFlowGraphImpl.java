package org.dxdomain.analyzer.common.cfg.impl;

import org.dxdomain.analyzer.common.cfg.BasicBlock;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.operation.Operation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ControlFlowGraphImpl implements ControlFlowGraph {
    private final List<BasicBlock> blocks;

    private ControlFlowGraphImpl(List<BasicBlock> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    @Override
    public List<BasicBlock> blocks() {
        return blocks;
    }

    @Override
    public String toString() {
        return blocks.toString();
    }

    public static class Builder {
        private final List<BasicBlock> blocks = new ArrayList<>();

        public Builder addBlock(Operation... operations) {
            return addBlock(Arrays.asList(operations), null);
        }

        public Builder addBranchingBlock(Operation branchValue, Operation... operations) {
            return addBlock(Arrays.asList(operations), branchValue);
        }

        public Builder addBlock(List<Operation> operations, Operation branchValue) {
            blocks.add(new BasicBlockImpl(blocks.size(), operations, branchValue));
            return this;
        }

        public ControlFlowGraph build() {
            return new ControlFlowGraphImpl(blocks);
        }
    }
}
