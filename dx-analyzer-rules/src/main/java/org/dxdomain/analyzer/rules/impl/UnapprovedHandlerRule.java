package org.dxdomain.analyzer.rules.impl;

import org.dxdomain.analyzer.common.cfg.MethodInfo;
import org.dxdomain.analyzer.common.operation.Invocation;
import org.dxdomain.analyzer.common.operation.Operation;
import org.dxdomain.analyzer.common.symbol.MethodRef;
import org.dxdomain.analyzer.resultflow.FlowDiagnostic;
import org.dxdomain.analyzer.resultflow.FlowGraph;
import org.dxdomain.analyzer.rules.AnalyzerServices;
import org.dxdomain.analyzer.rules.DiagnosticDescriptor;
import org.dxdomain.analyzer.rules.Finding;
import org.dxdomain.analyzer.rules.Rule;
import org.dxdomain.analyzer.rules.Severity;
import org.dxdomain.analyzer.rules.scope.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * DXA030: a result value is passed to a method that is neither a configured handler, nor a configured
 * terminalizer, nor one of the conventional result combinators.
 * <p>
 * Calls into S3 code are not reported. At most one finding per call site.
 */
public class UnapprovedHandlerRule implements Rule {
    public static final String APPROVED_MEMBER_NAMES_KEY = "dx.result.approvedMemberNames";
    public static final List<String> DEFAULT_APPROVED_MEMBER_NAMES = List.of("match", "map", "bind", "onSuccess",
            "onFailure", "tap", "ensure", "thenAsync", "andFinally");

    public static final DiagnosticDescriptor DESCRIPTOR = new DiagnosticDescriptor("DXA030",
            "Unapproved Handler Usage",
            "Result passed to an unapproved handler. Register the handler in the analyzer configuration or use a known adapter.",
            "Domain.ResultHandling",
            Severity.WARNING,
            true,
            "Result values should only be passed to approved handlers to ensure explicit and analyzable result handling.");

    @Override
    public DiagnosticDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public List<Finding> check(MethodInfo methodInfo, AnalyzerServices services) {
        FlowGraph flowGraph = services.flowEngine().analyze(methodInfo, services.flowContext(),
                services.cancellationToken());
        if (!flowGraph.valid()) return List.of();

        List<String> configured = services.options().getList(APPROVED_MEMBER_NAMES_KEY);
        Set<String> approved = Set.copyOf(configured.isEmpty() ? DEFAULT_APPROVED_MEMBER_NAMES : configured);
        Set<Operation> reported = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Finding> findings = new ArrayList<>();

        for (FlowDiagnostic note : flowGraph.diagnostics(FlowDiagnostic.Kind.UNCONFIGURED_CALL)) {
            if (!(note.operation() instanceof Invocation invocation)) continue;
            MethodRef target = invocation.targetMethod();
            if (approved.contains(target.name())) continue;
            if (services.scopeResolver().resolve(target.declaringType()) == Scope.S3) continue;
            if (reported.add(invocation)) {
                findings.add(new Finding(DESCRIPTOR, methodInfo.methodRef(), invocation.source(),
                        DESCRIPTOR.messageFormat() + " Target: " + target + "."));
            }
        }
        return findings;
    }
}
