package org.dxdomain.analyzer.common.cfg.impl;

import org.dxdomain.analyzer.common.cfg.BasicBlock;
import org.dxdomain.analyzer.common.cfg.ControlFlowGraph;
import org.dxdomain.analyzer.common.operation.*;
import org.dxdomain.analyzer.common.symbol.Parameter;
import org.dxdomain.analyzer.common.type.TypeRef;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.Map;

/*
SHA-256 over a canonical rendering of the graph, source positions included: flow graphs hand out the
producer operations and their positions, so a body that moved must not share a graph with its old self.

Locals and parameters are numbered in order of first occurrence, by identity: two distinct locals that
happen to share a name render differently, and renaming a local does not change the fingerprint.
 */
public final class StructuralFingerprint {

    private StructuralFingerprint() {
    }

    public static String compute(ControlFlowGraph controlFlowGraph) {
        StringBuilder sb = new StringBuilder();
        Map<Object, Integer> symbols = new IdentityHashMap<>();
        for (BasicBlock block : controlFlowGraph.blocks()) {
            sb.append("B").append(block.ordinal()).append('{');
            for (Operation operation : block.operations()) {
                render(operation, symbols, sb);
                sb.append(';');
            }
            if (block.branchValue() != null) {
                sb.append('?');
                render(block.branchValue(), symbols, sb);
            }
            sb.append('}');
        }
        return sha256(sb.toString());
    }

    static void render(Operation operation, Map<Object, Integer> symbols, StringBuilder sb) {
        sb.append(operation.kind().name()).append('[').append(detail(operation, symbols)).append(':')
                .append(typeName(operation.type())).append('@').append(position(operation.source())).append(']');
        if (!operation.children().isEmpty()) {
            sb.append('(');
            for (Operation child : operation.children()) {
                render(child, symbols, sb);
                sb.append(',');
            }
            sb.append(')');
        }
    }

    private static String detail(Operation operation, Map<Object, Integer> symbols) {
        return switch (operation.kind()) {
            case INVOCATION -> ((Invocation) operation).targetMethod().fullyQualifiedName();
            case MEMBER_REFERENCE -> ((MemberReference) operation).memberName();
            case LOCAL_REFERENCE -> "L" + symbolNumber(((LocalReference) operation).local(), symbols);
            case PARAMETER_REFERENCE -> {
                Parameter parameter = ((ParameterReference) operation).parameter();
                yield "P" + parameter.index() + "#" + symbolNumber(parameter, symbols);
            }
            case LITERAL -> ((Literal) operation).text();
            case IS_PATTERN -> ((IsPattern) operation).pattern();
            case IS_TYPE -> ((IsType) operation).testedType().displayName();
            case OTHER -> ((OtherOperation) operation).description();
            case OBJECT_CREATION, SIMPLE_ASSIGNMENT, RETURN, CONDITIONAL, CONDITIONAL_ACCESS,
                    CONDITIONAL_ACCESS_INSTANCE, CONVERSION, PARENTHESIZED -> "";
        };
    }

    private static int symbolNumber(Object symbol, Map<Object, Integer> symbols) {
        Integer number = symbols.get(symbol);
        if (number != null) return number;
        int next = symbols.size();
        symbols.put(symbol, next);
        return next;
    }

    private static String position(Source source) {
        return source == null ? "-" : source.toString();
    }

    private static String typeName(TypeRef typeRef) {
        return typeRef == null ? "-" : typeRef.displayName();
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
