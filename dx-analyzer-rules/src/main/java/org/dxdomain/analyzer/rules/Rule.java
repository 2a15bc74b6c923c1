package org.dxdomain.analyzer.rules;

import org.dxdomain.analyzer.common.cfg.MethodInfo;

import java.util.List;

public interface Rule {

    DiagnosticDescriptor descriptor();

    List<Finding> check(MethodInfo methodInfo, AnalyzerServices services);
}
