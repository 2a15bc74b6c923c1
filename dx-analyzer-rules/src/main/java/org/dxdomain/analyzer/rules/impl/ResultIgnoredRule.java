package org.dxdomain.analyzer.rules.impl;

import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.resultflow.ResultNode;
import org.dxdomain.analyzer.resultflow.ResultState;
import org.dxdomain.analyzer.rules.AnalyzerServices;
import org.dxdomain.analyzer.rules.DiagnosticDescriptor;
import org.dxdomain.analyzer.rules.Finding;
import org.dxdomain.analyzer.rules.Rule;
import org.dxdomain.analyzer.rules.Severity;
import org.dxdomain.analyzer.rules.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * DXA020: a result value is produced, and then neither checked, returned, nor handed to a handler or
 * terminalizer.
 * <p>
 * Kernel code (scope S0) is exempt. An invalid flow graph yields no findings: there is not enough
 * information to decide.
 */
public class ResultIgnoredRule implements Rule {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultIgnoredRule.class);

    public static final DiagnosticDescriptor DESCRIPTOR = new DiagnosticDescriptor("DXA020",
            "Result Ignored",
            "Result value is produced and ignored. Either handle, return, or explicitly discard with intent.",
            "Domain.ResultHandling",
            Severity.ERROR,
            true,
            "Result instances must be explicitly handled to prevent silent failures and lost domain errors.");

    @Override
    public DiagnosticDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public List<Finding> check(MethodInfo methodInfo, AnalyzerServices services) {
        Scope scope = services.scopeResolver().resolve(methodInfo.methodRef().declaringType());
        if (scope == Scope.S0) return List.of();

        FlowGraph flowGraph = services.flowEngine().analyze(methodInfo, services.flowContext(),
                services.cancellationToken());
        if (!flowGraph.valid()) {
            LOGGER.debug("Inconclusive flow graph for {}, not reporting", methodInfo);
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (ResultNode node : flowGraph.nodesWithState(ResultState.IGNORED)) {
            findings.add(new Finding(DESCRIPTOR, methodInfo.methodRef(), node.producer().source(),
                    DESCRIPTOR.messageFormat()));
        }
        return findings;
    }
}
