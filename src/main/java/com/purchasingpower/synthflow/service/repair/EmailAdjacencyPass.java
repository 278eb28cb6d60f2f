package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.Optional;

/**
 * Makes an email ordering check also reject an '@' directly followed by the last '.'.
 *
 * <pre>
 * if (email.indexOf('@') &gt; email.lastIndexOf('.')) {
 *     return false;
 * }
 *   ==&gt;
 * if (email.indexOf('@') &gt;= email.lastIndexOf('.') || email.lastIndexOf('.') - email.indexOf('@') == 1) {
 *     return false;
 * }
 * </pre>
 *
 * The mirrored form {@code email.lastIndexOf('.') < email.indexOf('@')} is handled the same way.
 * The rewritten condition is an OR, so the pass never matches its own output.
 */
class EmailAdjacencyPass implements RepairPass {

    @Override
    public String name() {
        return "email-adjacency";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            for (IfStmt ifStmt : method.findAll(IfStmt.class)) {
                Optional<Positions> positions = orderingCheck(ifStmt);
                if (positions.isPresent()) {
                    ifStmt.setCondition(adjacencyAwareCondition(positions.get()));
                    modified = true;
                }
            }
        }
        return modified;
    }

    private record Positions(MethodCallExpr at, MethodCallExpr dot) {
    }

    private Optional<Positions> orderingCheck(IfStmt ifStmt) {
        if (!ifStmt.getCondition().isBinaryExpr() || !rejects(ifStmt.getThenStmt())) {
            return Optional.empty();
        }
        BinaryExpr comparison = ifStmt.getCondition().asBinaryExpr();
        Expression left = comparison.getLeft();
        Expression right = comparison.getRight();

        if (comparison.getOperator() == BinaryExpr.Operator.GREATER
                && isPositionCall(left, "indexOf", '@')
                && isPositionCall(right, "lastIndexOf", '.')
                && sameReceiver(left, right)) {
            return Optional.of(new Positions(left.asMethodCallExpr(), right.asMethodCallExpr()));
        }
        if (comparison.getOperator() == BinaryExpr.Operator.LESS
                && isPositionCall(left, "lastIndexOf", '.')
                && isPositionCall(right, "indexOf", '@')
                && sameReceiver(left, right)) {
            return Optional.of(new Positions(right.asMethodCallExpr(), left.asMethodCallExpr()));
        }
        return Optional.empty();
    }

    private static Expression adjacencyAwareCondition(Positions positions) {
        BinaryExpr notBefore = new BinaryExpr(
                positions.at().clone(), positions.dot().clone(), BinaryExpr.Operator.GREATER_EQUALS);
        BinaryExpr gap = new BinaryExpr(
                positions.dot().clone(), positions.at().clone(), BinaryExpr.Operator.MINUS);
        BinaryExpr adjacent = new BinaryExpr(gap, new IntegerLiteralExpr("1"), BinaryExpr.Operator.EQUALS);
        return new BinaryExpr(notBefore, adjacent, BinaryExpr.Operator.OR);
    }

    /** {@code return false;} alone, bare or in a block. */
    private static boolean rejects(Statement then) {
        Statement only = then;
        if (then.isBlockStmt()) {
            NodeList<Statement> statements = then.asBlockStmt().getStatements();
            if (statements.size() != 1) {
                return false;
            }
            only = statements.get(0);
        }
        if (!only.isReturnStmt()) {
            return false;
        }
        ReturnStmt returnStmt = only.asReturnStmt();
        return returnStmt.getExpression()
                .filter(Expression::isBooleanLiteralExpr)
                .map(e -> !e.asBooleanLiteralExpr().getValue())
                .orElse(false);
    }

    private static boolean isPositionCall(Expression expression, String method, char symbol) {
        if (!expression.isMethodCallExpr()) {
            return false;
        }
        MethodCallExpr call = expression.asMethodCallExpr();
        if (!call.getNameAsString().equals(method) || call.getArguments().size() != 1 || call.getScope().isEmpty()) {
            return false;
        }
        Expression argument = call.getArgument(0);
        if (argument.isCharLiteralExpr()) {
            return argument.asCharLiteralExpr().asChar() == symbol;
        }
        return argument.isStringLiteralExpr() && argument.asStringLiteralExpr().asString().equals(String.valueOf(symbol));
    }

    private static boolean sameReceiver(Expression first, Expression second) {
        return first.asMethodCallExpr().getScope().equals(second.asMethodCallExpr().getScope());
    }
}
