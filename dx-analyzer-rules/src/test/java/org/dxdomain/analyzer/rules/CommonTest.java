package org.dxdomain.analyzer.rules;

import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.cfg.impl.ControlFlowGraphImpl;
import org.dxdomain.analyzer.common.cfg.impl.MethodInfoImpl;
import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.config.EditorConfigParser;
import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.LocalVariable;
import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.common.type.MapTypeOracle;
import org.dxdomain.analyzer.common.type.NamedType;
import org.dxdomain.analyzer.common.type.PrimitiveType;
import org.dxdomain.analyzer.common.type.TypeOracle;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

public class CommonTest {
    protected static final NamedType STRING = NamedType.of("java.lang.String");
    protected static final NamedType RESULT_DEFINITION = NamedType.of("org.dxdomain.Result");
    protected static final NamedType RESULT = NamedType.of("org.dxdomain.Result", STRING);
    protected static final NamedType KERNEL = NamedType.of("org.dxdomain.internal.ResultKernel");
    protected static final NamedType SERVICE = NamedType.of("com.acme.orders.OrderService");
    protected static final NamedType HELPER = NamedType.of("com.acme.orders.OrderHelper");
    protected static final NamedType RESULTS = NamedType.of("com.acme.shared.Results");
    protected static final NamedType RESULT_LOG = NamedType.of("com.acme.shared.ResultLog");
    protected static final NamedType OBJECTS = NamedType.of("java.util.Objects");

    protected static final MethodRef CREATE_ORDER = new MethodRef(SERVICE, "createOrder", RESULT);
    protected static final MethodRef AUDIT = new MethodRef(HELPER, "audit", PrimitiveType.VOID);
    protected static final MethodRef COMBINE = new MethodRef(HELPER, "combine", PrimitiveType.VOID);
    protected static final MethodRef HELPER_MAP = new MethodRef(HELPER, "map", RESULT);
    protected static final MethodRef FORWARD = new MethodRef(RESULTS, "forward", RESULT);
    protected static final MethodRef CONSUME = new MethodRef(RESULT_LOG, "consume", PrimitiveType.VOID);
    protected static final MethodRef REQUIRE_NON_NULL = new MethodRef(OBJECTS, "requireNonNull", RESULT);

    @Language("EditorConfig")
    protected static final String EDITOR_CONFIG = """
            root = true

            [*.cs]
            dx.result.handlers = com.acme.shared.Results.forward
            dx.result.terminalizers = com.acme.shared.ResultLog.consume
            dx.scope.map = org.dxdomain=S0;com.acme.shared=S1
            dx.scope.rootNamespaces = com.acme
            """;

    protected TypeOracle typeOracle;
    protected AnalyzerConfigOptions options;
    protected AnalyzerServices services;

    @BeforeEach
    public void beforeEach() {
        typeOracle = MapTypeOracle.of(RESULT_DEFINITION, STRING, SERVICE, HELPER, RESULTS, RESULT_LOG, OBJECTS);
        options = new EditorConfigParser().parse(EDITOR_CONFIG);
        services = AnalyzerServices.create(typeOracle, options);
    }

    protected static MethodInfo method(NamedType owner, String name, Operation... operations) {
        return MethodInfoImpl.of(new MethodRef(owner, name, RESULT),
                new ControlFlowGraphImpl.Builder().addBlock(operations).build());
    }

    protected static MethodInfo method(String name, Operation... operations) {
        return method(SERVICE, name, operations);
    }

    protected static ObjectCreation newResult(int line) {
        return new ObjectCreation(RESULT, List.of(), Source.at(line, 17));
    }

    protected static Invocation staticCall(MethodRef methodRef, int line, Operation... arguments) {
        return new Invocation(methodRef, null, List.of(arguments), Source.at(line, 9));
    }

    protected static LocalVariable local(String name) {
        return new LocalVariable(name, RESULT);
    }

    protected static LocalReference ref(LocalVariable localVariable) {
        return new LocalReference(localVariable, null);
    }

    protected static SimpleAssignment assign(LocalVariable localVariable, Operation value) {
        return new SimpleAssignment(ref(localVariable), value, null);
    }

    protected static Return ret(Operation value) {
        return new Return(value, null);
    }

    protected static OtherOperation statement(Operation expression) {
        return new OtherOperation("expression-statement", List.of(expression), null, null);
    }
}
