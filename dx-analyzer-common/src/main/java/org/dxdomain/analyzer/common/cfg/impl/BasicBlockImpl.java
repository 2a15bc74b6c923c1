package org.dxdomain.analyzer.common.cfg.impl;

import org.dxdomain.analyzer.common.cfg.BasicBlock;
import org.dxdomain.analyzer.common.operation.Operation;

import java.util.List;

public record BasicBlockImpl(int ordinal, List<Operation> operations, Operation branchValue) implements BasicBlock {

    public BasicBlockImpl {
        operations = List.copyOf(operations);
    }

    @Override
    public String toString() {
        return "B" + ordinal + operations + (branchValue == null ? "" : " ? " + branchValue);
    }
}
