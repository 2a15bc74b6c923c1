package org.dxdomain.analyzer.resultflow.impl;

import org.dxdomain.analyzer.common.cfg.BasicBlock;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.resultflow.FlowDiagnostic;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.resultflow.ResultFlowContext;
import org.dxdomain.analyzer.resultflow.ResultNode;
import org.dxdomain.analyzer.resultflow.ResultState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
One run over one method. Three phases:

- discovery: every invocation, object creation or member read of a sentinel type becomes a node (CREATED);
- usage: returns propagate, configured handlers propagate, configured terminalizers terminate,
  member access on a tracked value inside a conditional construct or a branch value checks;
- finalization: nodes still CREATED become IGNORED.

Not thread-safe; create one per method.
 */
class MethodFlowAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MethodFlowAnalyzer.class);
    static final Logger PROMOTE = LoggerFactory.getLogger("dx.resultflow.promote");

    private enum Usage {RETURN, CALL, INSPECTION, NONE}

    private final MethodInfo methodInfo;
    private final ControlFlowGraph cfg;
    private final ResultFlowContext context;
    private final NodeTable nodeTable = new NodeTable();
    private final AliasResolver aliasResolver;
    private final List<FlowDiagnostic> diagnostics = new ArrayList<>();

    MethodFlowAnalyzer(MethodInfo methodInfo, ControlFlowGraph cfg, ResultFlowContext context) {
        this.methodInfo = methodInfo;
        this.cfg = cfg;
        this.context = context;
        this.aliasResolver = new AliasResolver(cfg, nodeTable);
    }

    FlowGraph run() {
        LOGGER.debug("Result flow: do method {}, {} blocks", methodInfo, cfg.blocks().size());
        discoverProducers();
        LOGGER.debug("Discovered {} result nodes in {}", nodeTable.size(), methodInfo);
        analyzeUsage();
        return nodeTable.freeze(diagnostics);
    }

    // ---- discovery

    private void discoverProducers() {
        // the target of 'this.last = r' is written, not produced
        Set<Operation> assignmentTargets = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BasicBlock block : cfg.blocks()) {
            for (Operation operation : block.operations()) {
                operation.visit(o -> {
                    if (o instanceof SimpleAssignment assignment) {
                        assignmentTargets.add(assignment.target());
                    } else if (isProducerKind(o.kind()) && context.isSentinel(o.type())
                               && !assignmentTargets.contains(o)) {
                        nodeTable.register(o);
                    }
                    return true;
                });
            }
        }
    }

    private static boolean isProducerKind(OperationKind kind) {
        return switch (kind) {
            case INVOCATION, OBJECT_CREATION, MEMBER_REFERENCE -> true;
            case SIMPLE_ASSIGNMENT, RETURN, CONDITIONAL, CONDITIONAL_ACCESS, CONDITIONAL_ACCESS_INSTANCE,
                    IS_PATTERN, IS_TYPE, CONVERSION, PARENTHESIZED, LOCAL_REFERENCE, PARAMETER_REFERENCE,
                    LITERAL, OTHER -> false;
        };
    }

    // ---- usage

    private void analyzeUsage() {
        for (BasicBlock block : cfg.blocks()) {
            for (Operation operation : block.operations()) {
                analyzeOperationUsage(operation);
            }
            Operation branchValue = block.branchValue();
            if (branchValue != null) {
                analyzeOperationUsage(branchValue);
                // the branch value is the condition of an if, while, ...: reading from it inspects
                handleInspection(branchValue, true);
            }
        }
    }

    private void analyzeOperationUsage(Operation operation) {
        operation.visit(o -> {
            switch (usage(o.kind())) {
                case RETURN -> handleReturn((Return) o);
                case CALL -> handleInvocation((Invocation) o);
                case INSPECTION -> handleInspection(o, false);
                case NONE -> {
                }
            }
            return true;
        });
    }

    private static Usage usage(OperationKind kind) {
        return switch (kind) {
            case RETURN -> Usage.RETURN;
            case INVOCATION -> Usage.CALL;
            case CONDITIONAL, CONDITIONAL_ACCESS, CONDITIONAL_ACCESS_INSTANCE, IS_PATTERN, IS_TYPE -> Usage.INSPECTION;
            case OBJECT_CREATION, MEMBER_REFERENCE, SIMPLE_ASSIGNMENT, CONVERSION, PARENTHESIZED, LOCAL_REFERENCE,
                    PARAMETER_REFERENCE, LITERAL, OTHER -> Usage.NONE;
        };
    }

    private void handleReturn(Return ret) {
        ResultNode node = aliasResolver.resolve(ret.returnedValue());
        if (node != null) {
            promote(node, ResultState.PROPAGATED, ret);
        }
    }

    private void handleInvocation(Invocation invocation) {
        if (context.isSentinel(invocation.type())) {
            // chained calls create new obligations
            nodeTable.register(invocation);
        }
        MethodRef target = invocation.targetMethod();
        for (Operation argument : invocation.arguments()) {
            ResultNode node = aliasResolver.resolve(argument);
            if (node == null) continue;
            boolean isTerminalizer = context.isTerminalizer(target);
            boolean isHandler = context.isHandler(target);
            if (isTerminalizer) {
                if (isHandler) {
                    diagnostics.add(new FlowDiagnostic(FlowDiagnostic.Kind.HANDLER_TERMINALIZER_OVERLAP,
                            target + " is configured both as handler and as terminalizer; treated as terminalizer",
                            invocation, node));
                }
                promote(node, ResultState.TERMINATED, invocation);
            } else if (isHandler) {
                promote(node, ResultState.PROPAGATED, invocation);
            } else {
                diagnostics.add(new FlowDiagnostic(FlowDiagnostic.Kind.UNCONFIGURED_CALL,
                        "Result passed to " + target + ", which is neither handler nor terminalizer",
                        invocation, node));
            }
        }
    }

    /*
    Any member read or call directly on a tracked instance, inside the construct, checks that instance.
    Inside a conditional access 'r?.isSuccess', the instance is a placeholder standing for 'r'.
     */
    private void handleInspection(Operation construct, boolean includeSelf) {
        Map<Operation, Operation> placeholders = conditionalAccessPlaceholders(construct);
        (includeSelf ? construct.descendantsAndSelf() : construct.descendants()).forEach(d -> {
            Operation instance;
            if (d instanceof Invocation invocation) {
                instance = invocation.instance();
            } else if (d instanceof MemberReference memberReference) {
                instance = memberReference.instance();
            } else {
                return;
            }
            if (instance == null || !context.isSentinel(instance.type())) return;
            Operation actual = placeholders.getOrDefault(instance, instance);
            ResultNode node = aliasResolver.resolve(actual);
            if (node != null) {
                promote(node, ResultState.CHECKED, d);
            }
        });
    }

    private static Map<Operation, Operation> conditionalAccessPlaceholders(Operation construct) {
        Map<Operation, Operation> map = new IdentityHashMap<>();
        // pre-order: an inner conditional access overwrites what the outer one registered
        construct.descendantsAndSelf().forEach(o -> {
            if (o instanceof ConditionalAccess access) {
                access.whenNotNull().descendantsAndSelf()
                        .filter(p -> p.kind() == OperationKind.CONDITIONAL_ACCESS_INSTANCE)
                        .forEach(p -> map.put(p, access.instance()));
            }
        });
        return map;
    }

    private void promote(ResultNode node, ResultState newState, Operation at) {
        ResultState before = nodeTable.state(node);
        if (nodeTable.promote(node, newState)) {
            PROMOTE.debug("{}: {} -> {} at {}", node, before, newState, at.source() == null ? at : at.source());
        }
    }
}
