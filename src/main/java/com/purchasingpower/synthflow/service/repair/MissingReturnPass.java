package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.Optional;

/**
 * Appends a trailing return to non-void methods that can fall off their end.
 *
 * <p>Covers an {@code if / else if} chain without a final {@code else}, a trailing search loop,
 * and a body that ends in plain statements. The returned value is the most recently declared
 * top-level local of the method's return type, otherwise a sentinel literal for that type.
 */
class MissingReturnPass implements RepairPass {

    @Override
    public String name() {
        return "missing-return";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            if (method.getType().isVoidType()) {
                continue;
            }
            NodeList<Statement> statements = method.getBody().orElseThrow().getStatements();
            if (statements.isEmpty() || !fallsOffEnd(statements.get(statements.size() - 1))) {
                continue;
            }
            String value = lastLocalOfType(statements, method.getType().asString())
                    .orElseGet(() -> RepairSupport.sentinelFor(method.getType()));
            statements.add(JavaSourceParser.statement("return " + value + ";"));
            modified = true;
        }
        return modified;
    }

    private boolean fallsOffEnd(Statement last) {
        if (last.isReturnStmt() || last.isThrowStmt()) {
            return false;
        }
        if (last.isIfStmt()) {
            return lacksFinalElse(last.asIfStmt());
        }
        if (JavaSourceParser.isLoop(last)) {
            return RepairSupport.canExitNormally(last);
        }
        return last.isExpressionStmt();
    }

    private boolean lacksFinalElse(IfStmt ifStmt) {
        IfStmt current = ifStmt;
        while (current.getElseStmt().isPresent()) {
            Statement elseStmt = current.getElseStmt().get();
            if (!elseStmt.isIfStmt()) {
                return false;
            }
            current = elseStmt.asIfStmt();
        }
        return true;
    }

    private Optional<String> lastLocalOfType(NodeList<Statement> statements, String type) {
        String found = null;
        for (Statement statement : statements) {
            if (!statement.isExpressionStmt()
                    || !statement.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
                continue;
            }
            for (VariableDeclarator declarator : statement.asExpressionStmt().getExpression()
                    .asVariableDeclarationExpr().getVariables()) {
                if (declarator.getType().asString().equals(type)) {
                    found = declarator.getNameAsString();
                }
            }
        }
        return Optional.ofNullable(found);
    }
}
