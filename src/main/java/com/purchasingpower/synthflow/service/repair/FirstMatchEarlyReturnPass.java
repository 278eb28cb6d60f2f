package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.List;
import java.util.Optional;

/**
 * Turns an accumulate-to-last search into an early return when a first match is required.
 *
 * <pre>
 * int result = -1;                    for (...) {
 * for (...) {                             if (match) {
 *     if (match) {                            return i;
 *         result = i;        ==&gt;          }
 *     }                               }
 * }                                   return -1;
 * return result;
 * </pre>
 *
 * Runs only when the context carries a FIRST_MATCH loop constraint.
 */
class FirstMatchEarlyReturnPass implements RepairPass {

    @Override
    public String name() {
        return "first-match-early-return";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        if (!context.requiresFirstMatch()) {
            return false;
        }
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            modified |= rewrite(method.getBody().orElseThrow().getStatements());
        }
        return modified;
    }

    private boolean rewrite(NodeList<Statement> statements) {
        if (statements.size() < 3) {
            return false;
        }
        Statement last = statements.get(statements.size() - 1);
        Optional<String> returned = returnedVariable(last);
        if (returned.isEmpty()) {
            return false;
        }
        String variable = returned.get();

        for (int i = 0; i < statements.size() - 1; i++) {
            Optional<Expression> sentinel = literalDeclaration(statements.get(i), variable);
            if (sentinel.isEmpty()) {
                continue;
            }
            Optional<List<AssignExpr>> assignments = conditionalAssignments(statements, i + 1, variable);
            if (assignments.isEmpty()) {
                return false;
            }

            for (AssignExpr assignment : assignments.get()) {
                ExpressionStmt holder = (ExpressionStmt) assignment.getParentNode().orElseThrow();
                holder.replace(new ReturnStmt(assignment.getValue().clone()));
            }
            last.replace(new ReturnStmt(sentinel.get().clone()));
            statements.remove(i);
            return true;
        }
        return false;
    }

    private Optional<String> returnedVariable(Statement statement) {
        if (!statement.isReturnStmt()) {
            return Optional.empty();
        }
        return statement.asReturnStmt().getExpression()
                .filter(Expression::isNameExpr)
                .map(e -> e.asNameExpr().getNameAsString());
    }

    private Optional<Expression> literalDeclaration(Statement statement, String variable) {
        if (!statement.isExpressionStmt() || !statement.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
            return Optional.empty();
        }
        VariableDeclarationExpr declaration = statement.asExpressionStmt().getExpression().asVariableDeclarationExpr();
        if (declaration.getVariables().size() != 1) {
            return Optional.empty();
        }
        VariableDeclarator declarator = declaration.getVariable(0);
        if (!declarator.getNameAsString().equals(variable)) {
            return Optional.empty();
        }
        return declarator.getInitializer().filter(FirstMatchEarlyReturnPass::isLiteral);
    }

    /**
     * All writes to {@code variable} between the declaration and the final return must be plain
     * assignments directly inside an if within a single loop, with no break and no other reads.
     */
    private Optional<List<AssignExpr>> conditionalAssignments(NodeList<Statement> statements, int from, String variable) {
        List<Statement> between = statements.subList(from, statements.size() - 1);
        if (between.size() != 1 || !JavaSourceParser.isLoop(between.get(0))) {
            return Optional.empty();
        }
        Statement loop = between.get(0);
        if (!JavaSourceParser.findOwn(loop, BreakStmt.class).isEmpty()
                || !JavaSourceParser.findOwn(loop, ReturnStmt.class).isEmpty()) {
            return Optional.empty();
        }

        List<AssignExpr> assignments = JavaSourceParser.findOwn(loop, AssignExpr.class).stream()
                .filter(a -> a.getTarget().isNameExpr()
                        && a.getTarget().asNameExpr().getNameAsString().equals(variable))
                .toList();
        if (assignments.isEmpty()) {
            return Optional.empty();
        }

        long mentions = JavaSourceParser.findOwn(loop, NameExpr.class).stream()
                .filter(n -> n.getNameAsString().equals(variable))
                .count();
        if (mentions != assignments.size()) {
            return Optional.empty();
        }

        for (AssignExpr assignment : assignments) {
            if (assignment.getOperator() != AssignExpr.Operator.ASSIGN || !insideIf(assignment)) {
                return Optional.empty();
            }
        }
        return Optional.of(assignments);
    }

    private static boolean insideIf(AssignExpr assignment) {
        Optional<ExpressionStmt> holder = assignment.getParentNode()
                .filter(ExpressionStmt.class::isInstance)
                .map(ExpressionStmt.class::cast);
        if (holder.isEmpty()) {
            return false;
        }
        return holder.get().findAncestor(IfStmt.class).isPresent();
    }

    private static boolean isLiteral(Expression expression) {
        if (expression.isLiteralExpr()) {
            return true;
        }
        return expression.isUnaryExpr() && expression.asUnaryExpr().getExpression().isLiteralExpr();
    }
}
