package org.dxdomain.analyzer.resultflow;

import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.LocalVariable;
import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestInspection extends CommonTest {

    @DisplayName("r.isSuccess() ? a : b")
    @Test
    public void test1() {
        LocalVariable r = local("r");
        LocalVariable s = new LocalVariable("s", STRING);
        Conditional conditional = new Conditional(call(IS_SUCCESS, ref(r)), literal("\"a\""), literal("\"b\""),
                STRING, null);
        FlowGraph fg = analyze(assign(r, staticCall(CREATE_ORDER)), assign(s, conditional));
        assertEquals(ResultState.CHECKED, onlyState(fg));
    }

    @DisplayName("r?.value")
    @Test
    public void test2() {
        LocalVariable r = local("r");
        LocalVariable s = new LocalVariable("s", STRING);
        ConditionalAccess access = new ConditionalAccess(ref(r),
                member(new ConditionalAccessInstance(RESULT, null), "value", STRING), null);
        FlowGraph fg = analyze(assign(r, newResult()), assign(s, access));
        assertEquals(ResultState.CHECKED, onlyState(fg));
    }

    @DisplayName("r is Result: no member read, not checked")
    @Test
    public void test3() {
        LocalVariable r = local("r");
        LocalVariable b = new LocalVariable("b", PrimitiveType.BOOLEAN);
        FlowGraph fg = analyze(assign(r, newResult()), assign(b, new IsType(ref(r), RESULT, null)));
        assertEquals(ResultState.IGNORED, onlyState(fg));
    }

    @DisplayName("r.isFailure is true")
    @Test
    public void test4() {
        LocalVariable r = local("r");
        LocalVariable b = new LocalVariable("b", PrimitiveType.BOOLEAN);
        IsPattern isPattern = new IsPattern(member(ref(r), "isFailure", PrimitiveType.BOOLEAN), "true", null);
        FlowGraph fg = analyze(assign(r, newResult()), assign(b, isPattern));
        assertEquals(ResultState.CHECKED, onlyState(fg));
    }

    @DisplayName("member read outside any conditional construct does not check")
    @Test
    public void test5() {
        LocalVariable r = local("r");
        LocalVariable s = new LocalVariable("s", STRING);
        FlowGraph fg = analyze(assign(r, newResult()), assign(s, member(ref(r), "value", STRING)));
        assertEquals(ResultState.IGNORED, onlyState(fg));
    }

    @DisplayName("checked, then terminated")
    @Test
    public void test6() {
        LocalVariable r = local("r");
        LocalVariable s = new LocalVariable("s", STRING);
        Conditional conditional = new Conditional(call(IS_SUCCESS, ref(r)), literal("\"a\""), literal("\"b\""),
                STRING, null);
        FlowGraph fg = analyze(assign(r, newResult()), assign(s, conditional), statement(staticCall(CONSUME, ref(r))));
        assertEquals(ResultState.TERMINATED, onlyState(fg));
    }

    @DisplayName("checked, then propagated")
    @Test
    public void test7() {
        LocalVariable r = local("r");
        LocalVariable b = new LocalVariable("b", PrimitiveType.BOOLEAN);
        IsPattern isPattern = new IsPattern(call(IS_SUCCESS, ref(r)), "false", null);
        FlowGraph fg = analyze(assign(r, newResult()), assign(b, isPattern), ret(ref(r)));
        assertEquals(ResultState.PROPAGATED, onlyState(fg));
    }
}
