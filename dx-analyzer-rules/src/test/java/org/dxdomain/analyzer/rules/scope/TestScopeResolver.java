package org.dxdomain.analyzer.rules.scope;

import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.NamedType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestScopeResolver {

    private final ScopeResolver resolver = ScopeResolver.from(AnalyzerConfigOptions.of(Map.of(
            ScopeResolver.SCOPE_MAP_KEY, "org.dxdomain=S0; com.acme.shared=S1; com.acme.shared.legacy=S3;bad;x=S9",
            ScopeResolver.ROOT_NAMESPACES_KEY, "com.acme;com.partner")));

    @Test
    public void testMapped() {
        assertEquals(Scope.S0, resolver.resolve(NamedType.of("org.dxdomain.Result")));
        assertEquals(Scope.S0, resolver.resolve(NamedType.of("org.dxdomain.internal.Kernel")));
        assertEquals(Scope.S1, resolver.resolve(NamedType.of("com.acme.shared.Results")));
    }

    @Test
    public void testLongestPrefixWins() {
        assertEquals(Scope.S3, resolver.resolve(NamedType.of("com.acme.shared.legacy.OldResults")));
    }

    @Test
    public void testRootNamespaces() {
        assertEquals(Scope.S2, resolver.resolve(NamedType.of("com.acme.orders.OrderService")));
        assertEquals(Scope.S2, resolver.resolve(NamedType.of("com.partner.Invoice")));
        assertEquals(Scope.S3, resolver.resolve(NamedType.of("java.util.Objects")));
        assertEquals(Scope.S3, resolver.resolve(NamedType.of("NoPackage")));
    }

    @Test
    public void testPackageBoundary() {
        assertEquals(Scope.S2, resolver.resolvePackage("com.acme.sharedkernel"));
        assertEquals(Scope.S3, resolver.resolvePackage("com.acmex"));
        assertEquals(Scope.S3, resolver.resolvePackage("x"));
    }

    @Test
    public void testEmptyConfiguration() {
        ScopeResolver empty = ScopeResolver.from(AnalyzerConfigOptions.EMPTY);
        assertEquals(Scope.S3, empty.resolve(NamedType.of("org.dxdomain.Result")));
    }
}
