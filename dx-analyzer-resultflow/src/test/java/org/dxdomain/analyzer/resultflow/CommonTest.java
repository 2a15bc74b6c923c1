package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.CancellationToken;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.cfg.impl.ControlFlowGraphImpl;
import org.dxdomain.analyzer.common.cfg.impl.MethodInfoImpl;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.LocalVariable;
import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.common.symbol.Parameter;
import org.dxdomain.analyzer.common.type.MapTypeOracle;
import org.dxdomain.analyzer.common.type.NamedType;
import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.dxdomain.analyzer.common.type.TypeRef;
import org.dxdomain.analyzer.resultflow.impl.ResultFlowEngineImpl;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CommonTest {
    protected static final NamedType STRING = NamedType.of("java.lang.String");
    protected static final NamedType RESULT_DEFINITION = NamedType.of("org.dxdomain.Result");
    protected static final NamedType RESULT = NamedType.of("org.dxdomain.Result", STRING);
    protected static final NamedType SERVICE = NamedType.of("com.acme.orders.OrderService");
    protected static final NamedType RESULTS = NamedType.of("com.acme.shared.Results");
    protected static final NamedType RESULT_LOG = NamedType.of("com.acme.shared.ResultLog");
    protected static final NamedType MISC = NamedType.of("com.acme.util.Misc");

    protected static final MethodRef CREATE_ORDER = new MethodRef(SERVICE, "createOrder", RESULT);
    protected static final MethodRef IS_SUCCESS = new MethodRef(RESULT, "isSuccess", PrimitiveType.BOOLEAN);
    protected static final MethodRef MAP = new MethodRef(RESULT, "map", RESULT);
    protected static final MethodRef FORWARD = new MethodRef(RESULTS, "forward", RESULT);
    protected static final MethodRef CONSUME = new MethodRef(RESULT_LOG, "consume", PrimitiveType.VOID);
    protected static final MethodRef PRINT = new MethodRef(MISC, "print", PrimitiveType.VOID);

    protected static final AnalyzerConfigOptions OPTIONS = AnalyzerConfigOptions.of(Map.of(
            "dx.result.handlers", "com.acme.shared.Results.forward",
            "dx.result.terminalizers", "com.acme.shared.ResultLog.consume"));

    protected TypeOracle typeOracle;
    protected ResultFlowEngine engine;
    protected ResultFlowContext context;

    @BeforeEach
    public void beforeEach() {
        typeOracle = MapTypeOracle.of(RESULT_DEFINITION, STRING, SERVICE, RESULTS, RESULT_LOG, MISC);
        engine = new ResultFlowEngineImpl();
        context = engine.createContext(typeOracle, OPTIONS);
    }

    protected FlowGraph analyze(MethodInfo methodInfo) {
        return engine.analyze(methodInfo, context, CancellationToken.NONE);
    }

    protected FlowGraph analyze(Operation... operations) {
        return analyze(method("method", cfg(operations)));
    }

    protected static ResultState onlyState(FlowGraph flowGraph) {
        assertTrue(flowGraph.valid());
        assertEquals(1, flowGraph.nodes().size(), () -> "Nodes: " + flowGraph.nodes());
        return flowGraph.state(flowGraph.nodes().get(0));
    }

    protected static MethodInfo method(String name, ControlFlowGraph cfg) {
        return MethodInfoImpl.of(new MethodRef(SERVICE, name, RESULT), cfg);
    }

    protected static ControlFlowGraph cfg(Operation... operations) {
        return new ControlFlowGraphImpl.Builder().addBlock(operations).build();
    }

    protected static ObjectCreation newResult() {
        return new ObjectCreation(RESULT, List.of(), null);
    }

    protected static Invocation call(MethodRef methodRef, Operation instance, Operation... arguments) {
        return new Invocation(methodRef, instance, List.of(arguments), null);
    }

    protected static Invocation staticCall(MethodRef methodRef, Operation... arguments) {
        return call(methodRef, null, arguments);
    }

    protected static LocalVariable local(String name) {
        return new LocalVariable(name, RESULT);
    }

    protected static LocalReference ref(LocalVariable localVariable) {
        return new LocalReference(localVariable, null);
    }

    protected static ParameterReference ref(Parameter parameter) {
        return new ParameterReference(parameter, null);
    }

    protected static SimpleAssignment assign(LocalVariable localVariable, Operation value) {
        return new SimpleAssignment(ref(localVariable), value, null);
    }

    protected static Return ret(Operation value) {
        return new Return(value, null);
    }

    protected static MemberReference member(Operation instance, String name, TypeRef type) {
        return new MemberReference(instance, name, type, null);
    }

    protected static Literal literal(String text) {
        return new Literal(text, STRING, null);
    }

    protected static OtherOperation statement(Operation expression) {
        return new OtherOperation("expression-statement", List.of(expression), null, null);
    }
}
