package org.dxdomain.analyzer.rules.scope;

public enum Scope {
    S0, // kernel
    S1, // shared
    S2, // domain
    S3  // application
}
