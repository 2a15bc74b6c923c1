package org.dxdomain.analyzer.common.cfg;

import org.dxdomain.analyzer.common.operation.Operation;

import java.util.List;

public interface BasicBlock {

    int ordinal();

    List<Operation> operations();

    /*
    the value on which the block branches at its end (the condition of an if, while, ...);
    null when the block falls through or jumps unconditionally
     */
    Operation branchValue();
}
