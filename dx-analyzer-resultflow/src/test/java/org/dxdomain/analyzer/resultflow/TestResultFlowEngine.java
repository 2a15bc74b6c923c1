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
import org.dxdomain.analyzer.common.type.ErrorType;
import org.dxdomain.analyzer.common.type.MapTypeOracle;
import org.dxdomain.analyzer.common.type.NamedType;
import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.dxdomain.analyzer.resultflow.impl.ResultFlowEngineImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class TestResultFlowEngine extends CommonTest {

    @DisplayName("return of a fresh result propagates")
    @Test
    public void test1() {
        FlowGraph fg = analyze(ret(newResult()));
        assertEquals(ResultState.PROPAGATED, onlyState(fg));
        assertTrue(fg.diagnostics().isEmpty());
    }

    @DisplayName("assigned to a local that is never read again: ignored")
    @Test
    public void test2() {
        LocalVariable r = local("r");
        FlowGraph fg = analyze(assign(r, newResult()));
        assertEquals(ResultState.IGNORED, onlyState(fg));
    }

    @DisplayName("passed to a terminalizer, unrelated statements around it")
    @Test
    public void test3() {
        FlowGraph fg = analyze(statement(staticCall(PRINT, literal("\"before\""))),
                statement(staticCall(CONSUME, newResult())),
                statement(staticCall(PRINT, literal("\"after\""))));
        assertEquals(ResultState.TERMINATED, onlyState(fg));
    }

    @DisplayName("terminalizer reached through a local")
    @Test
    public void test3b() {
        LocalVariable r = local("r");
        FlowGraph fg = analyze(assign(r, staticCall(CREATE_ORDER)), statement(staticCall(CONSUME, ref(r))));
        assertEquals(ResultState.TERMINATED, onlyState(fg));
    }

    @DisplayName("flag read in an if condition, then dropped: checked")
    @Test
    public void test4() {
        LocalVariable r = local("r");
        ControlFlowGraph cfg = new ControlFlowGraphImpl.Builder()
                .addBranchingBlock(member(ref(r), "isSuccess", PrimitiveType.BOOLEAN), assign(r, staticCall(CREATE_ORDER)))
                .addBlock(statement(staticCall(PRINT, literal("\"ok\""))))
                .addBlock(ret(null))
                .build();
        FlowGraph fg = analyze(method("method", cfg));
        assertEquals(ResultState.CHECKED, onlyState(fg));
    }

    @DisplayName("passed to an unconfigured method: still ignored, with a note")
    @Test
    public void test5() {
        LocalVariable r = local("r");
        Invocation print = staticCall(PRINT, ref(r));
        FlowGraph fg = analyze(assign(r, newResult()), statement(print));
        assertEquals(ResultState.IGNORED, onlyState(fg));
        List<FlowDiagnostic> notes = fg.diagnostics(FlowDiagnostic.Kind.UNCONFIGURED_CALL);
        assertEquals(1, notes.size());
        assertSame(print, notes.get(0).operation());
        assertEquals(fg.nodes().get(0), notes.get(0).node());
    }

    @DisplayName("analyzing twice gives structurally equal graphs")
    @Test
    public void test6() {
        LocalVariable r = local("r");
        MethodInfo methodInfo = method("method", cfg(assign(r, newResult()), statement(staticCall(PRINT, ref(r))),
                ret(staticCall(CREATE_ORDER))));
        FlowGraph fg1 = analyze(methodInfo);
        FlowGraph fg2 = analyze(methodInfo);
        assertNotSame(fg1, fg2);
        assertEquals(fg1.nodes().size(), fg2.nodes().size());
        for (int i = 0; i < fg1.nodes().size(); i++) {
            ResultNode n1 = fg1.nodes().get(i);
            ResultNode n2 = fg2.nodes().get(i);
            assertEquals(n1.id(), n2.id());
            assertSame(n1.producer(), n2.producer());
            assertEquals(fg1.state(n1), fg2.state(n2));
        }
        assertEquals(fg1.diagnostics(), fg2.diagnostics());
    }

    @DisplayName("two identical expressions are two nodes")
    @Test
    public void test8() {
        ObjectCreation dropped = newResult();
        ObjectCreation returned = newResult();
        FlowGraph fg = analyze(statement(dropped), ret(returned));
        assertEquals(2, fg.nodes().size());
        ResultNode n0 = fg.nodes().get(0);
        ResultNode n1 = fg.nodes().get(1);
        assertSame(dropped, n0.producer());
        assertSame(returned, n1.producer());
        assertEquals(ResultState.IGNORED, fg.state(n0));
        assertEquals(ResultState.PROPAGATED, fg.state(n1));
        assertEquals(List.of(n0), fg.nodesWithState(ResultState.IGNORED));
    }

    @DisplayName("no body: invalid graph, never a pass")
    @Test
    public void testNoBody() {
        MethodInfo abstractMethod = MethodInfoImpl.withoutBody(new MethodRef(SERVICE, "abstractMethod", RESULT));
        FlowGraph fg = analyze(abstractMethod);
        assertFalse(fg.valid());
        assertTrue(fg.nodes().isEmpty());
        assertTrue(fg.nodeStates().isEmpty());
        assertEquals(1, fg.diagnostics().size());
        assertEquals(FlowDiagnostic.Kind.NO_ANALYZABLE_BODY, fg.diagnostics().get(0).kind());
    }

    @Test
    public void testEmptyBody() {
        FlowGraph fg = analyze(method("empty", new ControlFlowGraphImpl.Builder().build()));
        assertTrue(fg.valid());
        assertTrue(fg.nodes().isEmpty());
    }

    @Test
    public void testCancelledOnEntry() {
        CancellationToken.Signal signal = CancellationToken.signal();
        signal.cancel();
        MethodInfo methodInfo = method("method", cfg(ret(newResult())));
        assertThrows(CancellationException.class, () -> engine.analyze(methodInfo, context, signal.token()));
    }

    @Test
    public void testNullInputs() {
        MethodInfo methodInfo = method("method", cfg(ret(newResult())));
        assertThrows(NullPointerException.class, () -> engine.analyze(null, context, CancellationToken.NONE));
        assertThrows(NullPointerException.class, () -> engine.analyze(methodInfo, null, CancellationToken.NONE));
    }

    @DisplayName("a handler propagates; its own result is a new obligation")
    @Test
    public void testHandler() {
        LocalVariable r = local("r");
        Invocation forward = staticCall(FORWARD, ref(r));
        FlowGraph fg = analyze(assign(r, newResult()), ret(forward));
        assertEquals(2, fg.nodes().size());
        assertEquals(ResultState.PROPAGATED, fg.state(fg.nodes().get(0)));
        assertSame(forward, fg.nodes().get(1).producer());
        assertEquals(ResultState.PROPAGATED, fg.state(fg.nodes().get(1)));
    }

    @DisplayName("a handler result that is dropped is ignored")
    @Test
    public void testHandlerResultDropped() {
        FlowGraph fg = analyze(statement(staticCall(FORWARD, newResult())));
        assertEquals(2, fg.nodes().size());
        assertEquals(ResultState.PROPAGATED, fg.state(fg.nodes().get(1)));
        assertEquals(ResultState.IGNORED, fg.state(fg.nodes().get(0)));
    }

    @DisplayName("calling a method on a result is not an argument: the receiver is not discharged")
    @Test
    public void testChainedCall() {
        ObjectCreation creation = newResult();
        FlowGraph fg = analyze(ret(call(MAP, creation, literal("f"))));
        assertEquals(2, fg.nodes().size());
        assertSame(creation, fg.nodes().get(1).producer());
        assertEquals(ResultState.PROPAGATED, fg.state(fg.nodes().get(0)));
        assertEquals(ResultState.IGNORED, fg.state(fg.nodes().get(1)));
    }

    @DisplayName("same method as handler and terminalizer: terminalizer wins, with a note")
    @Test
    public void testOverlap() {
        AnalyzerConfigOptions both = AnalyzerConfigOptions.of(Map.of(
                "dx.result.handlers", "com.acme.shared.ResultLog.consume",
                "dx.result.terminalizers", "com.acme.shared.ResultLog.consume"));
        context = engine.createContext(typeOracle, both);
        FlowGraph fg = analyze(statement(staticCall(CONSUME, newResult())));
        assertEquals(ResultState.TERMINATED, onlyState(fg));
        assertEquals(1, fg.diagnostics(FlowDiagnostic.Kind.HANDLER_TERMINALIZER_OVERLAP).size());
    }

    @DisplayName("a member read of the result type is a producer")
    @Test
    public void testMemberReadProducer() {
        LocalVariable holder = new LocalVariable("holder", SERVICE);
        MemberReference last = member(ref(holder), "lastResult", RESULT);
        FlowGraph fg = analyze(ret(last));
        assertSame(last, fg.nodes().get(0).producer());
        assertEquals(ResultState.PROPAGATED, onlyState(fg));
    }

    @Test
    public void testUnresolvedTypeNotTracked() {
        FlowGraph fg = analyze(statement(new ObjectCreation(new ErrorType("Result"), List.of(), null)));
        assertTrue(fg.valid());
        assertTrue(fg.nodes().isEmpty());
    }

    @DisplayName("promotion never goes down")
    @Test
    public void testNoDowngrade() {
        LocalVariable r = local("r");
        LocalVariable s = local("s");
        FlowGraph fg = analyze(assign(r, newResult()), statement(staticCall(CONSUME, ref(r))), ret(ref(r)),
                assign(s, staticCall(CREATE_ORDER)), ret(ref(s)), statement(staticCall(PRINT, ref(s))));
        assertEquals(2, fg.nodes().size());
        assertEquals(ResultState.TERMINATED, fg.state(fg.nodes().get(0)));
        assertEquals(ResultState.PROPAGATED, fg.state(fg.nodes().get(1)));
    }

    @DisplayName("producers nested in the arguments of an unrelated call")
    @Test
    public void testNestedProducer() {
        Invocation inner = staticCall(CREATE_ORDER);
        Operation sum = new OtherOperation("+", List.of(literal("1"),
                member(inner, "size", PrimitiveType.INT)), PrimitiveType.INT, Source.at(3, 9));
        FlowGraph fg = analyze(ret(sum));
        assertSame(inner, fg.nodes().get(0).producer());
        assertEquals(ResultState.IGNORED, onlyState(fg));
    }
    @DisplayName("custom result types and configuration keys")
    @Test
    public void testConfiguration() {
        NamedType outcome = NamedType.of("com.acme.Outcome");
        MethodRef persist = new MethodRef(MISC, "persist", PrimitiveType.VOID);
        ResultFlowEngine.Configuration configuration = new ResultFlowEngineImpl.ConfigurationBuilder()
                .addResultTypeName("com.acme.Outcome")
                .setHandlerConfigKey("acme.handlers")
                .setTerminalizerConfigKey("acme.terminalizers")
                .build();
        ResultFlowEngine custom = new ResultFlowEngineImpl(configuration);
        AnalyzerConfigOptions options = AnalyzerConfigOptions.of("acme.terminalizers", "com.acme.util.Misc.persist");
        MethodInfo methodInfo = method("method", cfg(
                statement(staticCall(persist, new ObjectCreation(NamedType.of("com.acme.Outcome", STRING), List.of(), null))),
                statement(newResult())));
        FlowGraph fg = custom.analyze(methodInfo, MapTypeOracle.of(outcome, RESULT_DEFINITION), options);
        assertEquals(ResultState.TERMINATED, onlyState(fg));
        assertEquals(Set.of("com.acme.Outcome"), configuration.resultTypeNames());
    }

    @Test
    public void testDefaultConfiguration() {
        ResultFlowEngine.Configuration configuration = new ResultFlowEngineImpl.ConfigurationBuilder().build();
        assertEquals(Set.of(ResultFlowEngineImpl.DEFAULT_RESULT_TYPE), configuration.resultTypeNames());
        assertEquals("dx.result.handlers", configuration.handlerConfigKey());
        assertEquals("dx.result.terminalizers", configuration.terminalizerConfigKey());
    }
}
