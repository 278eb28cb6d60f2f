package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces {@code return x.getClass().getSimpleName();} with literal branches.
 *
 * <p>Runtime class names ("Integer", "ArrayList") never match the short literal type names a
 * String-returning classifier is specified to produce.
 */
class TypeIntrospectionPass implements RepairPass {

    private static final Set<String> NAME_ACCESSORS = Set.of("getSimpleName", "getName", "getTypeName");

    private static final Map<String, String> LITERAL_BRANCHES = new LinkedHashMap<>();

    static {
        LITERAL_BRANCHES.put("Integer", "int");
        LITERAL_BRANCHES.put("String", "str");
        LITERAL_BRANCHES.put("List", "list");
    }

    private static final String FALLBACK_LITERAL = "other";

    @Override
    public String name() {
        return "type-introspection";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            if (!method.getType().asString().equals("String")) {
                continue;
            }
            for (ReturnStmt returnStmt : JavaSourceParser.findOwn(method, ReturnStmt.class)) {
                Optional<String> subject = introspectedVariable(returnStmt);
                Optional<BlockStmt> parent = RepairSupport.parentBlock(returnStmt);
                if (subject.isPresent() && parent.isPresent()) {
                    replace(returnStmt, parent.get(), subject.get());
                    modified = true;
                }
            }
        }
        return modified;
    }

    private Optional<String> introspectedVariable(ReturnStmt returnStmt) {
        Optional<Expression> expression = returnStmt.getExpression();
        if (expression.isEmpty() || !expression.get().isMethodCallExpr()) {
            return Optional.empty();
        }
        MethodCallExpr accessor = expression.get().asMethodCallExpr();
        if (!NAME_ACCESSORS.contains(accessor.getNameAsString()) || accessor.getScope().isEmpty()
                || !accessor.getScope().get().isMethodCallExpr()) {
            return Optional.empty();
        }
        MethodCallExpr getClass = accessor.getScope().get().asMethodCallExpr();
        if (!getClass.getNameAsString().equals("getClass") || getClass.getScope().isEmpty()
                || !getClass.getScope().get().isNameExpr()) {
            return Optional.empty();
        }
        return Optional.of(getClass.getScope().get().asNameExpr().getNameAsString());
    }

    private void replace(ReturnStmt returnStmt, BlockStmt parent, String variable) {
        NodeList<Statement> statements = parent.getStatements();
        int index = RepairSupport.indexOf(statements, returnStmt);
        statements.remove(index);

        List<Statement> branches = new ArrayList<>();
        LITERAL_BRANCHES.forEach((type, literal) -> branches.add(JavaSourceParser.statement(
                "if (" + variable + " instanceof " + type + ") { return \"" + literal + "\"; }")));
        branches.add(JavaSourceParser.statement("return \"" + FALLBACK_LITERAL + "\";"));

        for (int i = 0; i < branches.size(); i++) {
            statements.add(index + i, branches.get(i));
        }
    }
}
