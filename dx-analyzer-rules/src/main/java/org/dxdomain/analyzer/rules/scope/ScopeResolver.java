package org.dxdomain.analyzer.rules.scope;

import org.dxdomain.analyzer.common.config.AnalyzerConfigOptions;
import org.dxdomain.analyzer.common.type.NamedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
Assigns a scope to a type from its package.

dx.scope.map = org.dxdomain=S0;com.acme.shared=S1
dx.scope.rootNamespaces = com.acme.orders;com.acme.billing

The longest mapped package prefix wins. Unmapped packages under one of the root namespaces are domain
code (S2); all others are application or library code (S3). Malformed map entries are skipped.
 */
public class ScopeResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScopeResolver.class);

    public static final String SCOPE_MAP_KEY = "dx.scope.map";
    public static final String ROOT_NAMESPACES_KEY = "dx.scope.rootNamespaces";

    private final Map<String, Scope> packageMap;
    private final List<String> rootNamespaces;

    public ScopeResolver(Map<String, Scope> packageMap, List<String> rootNamespaces) {
        this.packageMap = Map.copyOf(packageMap);
        this.rootNamespaces = List.copyOf(rootNamespaces);
    }

    public static ScopeResolver from(AnalyzerConfigOptions options) {
        Map<String, Scope> map = new HashMap<>();
        for (String entry : options.getList(SCOPE_MAP_KEY)) {
            String[] parts = entry.split("=");
            if (parts.length != 2) {
                LOGGER.debug("Skipping scope map entry {}", entry);
                continue;
            }
            try {
                map.put(parts[0].trim(), Scope.valueOf(parts[1].trim()));
            } catch (IllegalArgumentException iae) {
                LOGGER.debug("Unknown scope in entry {}", entry);
            }
        }
        return new ScopeResolver(map, options.getList(ROOT_NAMESPACES_KEY));
    }

    public Scope resolve(NamedType type) {
        return resolvePackage(type.packageName());
    }

    public Scope resolvePackage(String packageName) {
        String best = null;
        for (String prefix : packageMap.keySet()) {
            if (isInPackage(packageName, prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        if (best != null) return packageMap.get(best);
        for (String root : rootNamespaces) {
            if (isInPackage(packageName, root)) return Scope.S2;
        }
        return Scope.S3;
    }

    private static boolean isInPackage(String packageName, String prefix) {
        return packageName.equals(prefix) || packageName.startsWith(prefix + ".");
    }
}
