package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.Type;

import java.util.Optional;
import java.util.Set;

/**
 * AST helpers shared by the repair passes.
 */
final class RepairSupport {

    private static final Set<String> INTEGRAL = Set.of("int", "long", "short", "byte", "Integer", "Long");
    private static final Set<String> FLOATING = Set.of("double", "float", "Double", "Float");

    private RepairSupport() {
    }

    /**
     * Position of {@code node} in {@code list} by identity. Node#equals is structural, so
     * NodeList#indexOf can pick a look-alike sibling.
     */
    static int indexOf(NodeList<? extends Node> list, Node node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    static Optional<BlockStmt> parentBlock(Node node) {
        return node.getParentNode()
                .filter(BlockStmt.class::isInstance)
                .map(BlockStmt.class::cast);
    }

    static Optional<BlockStmt> loopBody(Statement loop) {
        Statement body = null;
        if (loop instanceof ForStmt forStmt) {
            body = forStmt.getBody();
        } else if (loop instanceof ForEachStmt forEach) {
            body = forEach.getBody();
        } else if (loop instanceof WhileStmt whileStmt) {
            body = whileStmt.getBody();
        }
        return body != null && body.isBlockStmt() ? Optional.of(body.asBlockStmt()) : Optional.empty();
    }

    /**
     * False for loops that only exit through return or break: {@code while (true)}, {@code for (;;)} and do-loops.
     */
    static boolean canExitNormally(Statement loop) {
        if (loop instanceof DoStmt) {
            return false;
        }
        if (loop instanceof WhileStmt whileStmt) {
            return !(whileStmt.getCondition() instanceof BooleanLiteralExpr literal && literal.getValue());
        }
        if (loop instanceof ForStmt forStmt) {
            return forStmt.getCompare().isPresent();
        }
        return true;
    }

    /**
     * Literal returned when a search finds nothing, chosen by declared return type.
     */
    static String sentinelFor(Type returnType) {
        String type = returnType.asString();
        if (INTEGRAL.contains(type)) {
            return "-1";
        }
        if (FLOATING.contains(type)) {
            return "0.0";
        }
        if (type.equals("boolean") || type.equals("Boolean")) {
            return "false";
        }
        if (type.equals("char")) {
            return "'\\0'";
        }
        return "null";
    }
}
