package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.Optional;
import java.util.Set;

/**
 * Un-nests a maximum check that was placed inside a minimum check.
 *
 * <pre>
 * if (x &lt; min) {                 if (x &lt; min) {
 *     min = x;                          min = x;
 *     if (x &gt; max) {      ==&gt;     }
 *         max = x;                  if (x &gt; max) {
 *     }                                 max = x;
 * }                                 }
 * </pre>
 *
 * Nested, the maximum only updates when a new minimum is found.
 */
class NestedMinMaxPass implements RepairPass {

    private static final Set<BinaryExpr.Operator> LESS = Set.of(
            BinaryExpr.Operator.LESS, BinaryExpr.Operator.LESS_EQUALS);

    private static final Set<BinaryExpr.Operator> GREATER = Set.of(
            BinaryExpr.Operator.GREATER, BinaryExpr.Operator.GREATER_EQUALS);

    @Override
    public String name() {
        return "nested-min-max";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            for (Statement loop : JavaSourceParser.findOwnLoops(method)) {
                Optional<BlockStmt> body = RepairSupport.loopBody(loop);
                if (body.isPresent()) {
                    modified |= unnest(body.get().getStatements());
                }
            }
        }
        return modified;
    }

    private boolean unnest(NodeList<Statement> loopStatements) {
        boolean modified = false;
        for (int i = 0; i < loopStatements.size(); i++) {
            Statement statement = loopStatements.get(i);
            if (!statement.isIfStmt()) {
                continue;
            }
            IfStmt minCheck = statement.asIfStmt();
            Optional<IfStmt> maxCheck = nestedMaxCheck(minCheck);
            if (maxCheck.isPresent()) {
                NodeList<Statement> inner = minCheck.getThenStmt().asBlockStmt().getStatements();
                inner.remove(RepairSupport.indexOf(inner, maxCheck.get()));
                loopStatements.add(i + 1, maxCheck.get());
                modified = true;
                i++;
            }
        }
        return modified;
    }

    private Optional<IfStmt> nestedMaxCheck(IfStmt candidate) {
        if (candidate.getElseStmt().isPresent()
                || !comparesWith(candidate.getCondition(), LESS)
                || !candidate.getThenStmt().isBlockStmt()) {
            return Optional.empty();
        }
        NodeList<Statement> inner = candidate.getThenStmt().asBlockStmt().getStatements();
        if (inner.size() < 2 || !isAssignment(inner.get(0))) {
            return Optional.empty();
        }
        for (int i = 1; i < inner.size(); i++) {
            Statement statement = inner.get(i);
            if (statement.isIfStmt() && isMaxCheck(statement.asIfStmt())) {
                return Optional.of(statement.asIfStmt());
            }
        }
        return Optional.empty();
    }

    private boolean isMaxCheck(IfStmt ifStmt) {
        if (ifStmt.getElseStmt().isPresent() || !comparesWith(ifStmt.getCondition(), GREATER)) {
            return false;
        }
        Statement then = ifStmt.getThenStmt();
        if (then.isBlockStmt()) {
            NodeList<Statement> statements = then.asBlockStmt().getStatements();
            return statements.size() == 1 && isAssignment(statements.get(0));
        }
        return isAssignment(then);
    }

    private static boolean comparesWith(Expression condition, Set<BinaryExpr.Operator> operators) {
        return condition.isBinaryExpr() && operators.contains(condition.asBinaryExpr().getOperator());
    }

    private static boolean isAssignment(Statement statement) {
        return statement.isExpressionStmt() && statement.asExpressionStmt().getExpression().isAssignExpr();
    }
}
