package org.dxdomain.analyzer.rules;

public enum Severity {
    INFO, WARNING, ERROR
}
