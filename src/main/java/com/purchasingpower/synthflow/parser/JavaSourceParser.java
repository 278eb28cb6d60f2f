package com.purchasingpower.synthflow.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.purchasingpower.synthflow.exception.SourceParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thin JavaParser wrapper shared by the validator and the repairer.
 *
 * <p>A fresh {@link JavaParser} is created per call because parser instances are not thread-safe.
 */
public final class JavaSourceParser {

    private static final ParserConfiguration CONFIGURATION = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    private JavaSourceParser() {
    }

    /**
     * Parses a complete compilation unit.
     *
     * @throws SourceParseException if the source is not syntactically valid Java
     */
    public static CompilationUnit parse(String sourceCode) {
        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(sourceCode);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        List<String> problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.toList());
        throw new SourceParseException("Generated code cannot be parsed: "
                + (problems.isEmpty() ? "unknown syntax error" : problems.get(0)), problems);
    }

    public static Optional<CompilationUnit> tryParse(String sourceCode) {
        if (sourceCode == null || sourceCode.isBlank()) {
            return Optional.empty();
        }
        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(sourceCode);
        return result.isSuccessful() ? result.getResult() : Optional.empty();
    }

    /**
     * Parses a statement from a fixed template. Templates are internal, so failure is a bug.
     */
    public static Statement statement(String code) {
        return new JavaParser(CONFIGURATION).parseStatement(code).getResult()
                .orElseThrow(() -> new IllegalStateException("Invalid statement template: " + code));
    }

    public static Expression expression(String code) {
        return new JavaParser(CONFIGURATION).parseExpression(code).getResult()
                .orElseThrow(() -> new IllegalStateException("Invalid expression template: " + code));
    }

    public static Optional<MethodDeclaration> findMethod(CompilationUnit cu, String methodName) {
        return cu.findFirst(MethodDeclaration.class, m -> m.getNameAsString().equals(methodName));
    }

    /**
     * Collects nodes of {@code type} below {@code root}, without descending into lambdas or
     * nested class bodies. Their statements belong to a different function.
     */
    public static <T extends Node> List<T> findOwn(Node root, Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(root, type, found);
        return found;
    }

    public static List<MethodDeclaration> targetMethods(CompilationUnit cu, String methodName) {
        return cu.findAll(MethodDeclaration.class,
                m -> m.getBody().isPresent() && (methodName == null || m.getNameAsString().equals(methodName)));
    }

    public static boolean isLoop(Node node) {
        return node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt;
    }

    public static List<Statement> findOwnLoops(Node root) {
        return findOwn(root, Statement.class).stream()
                .filter(JavaSourceParser::isLoop)
                .collect(Collectors.toList());
    }

    /**
     * Every identifier mentioned in the subtree: variables, fields and method names.
     */
    public static List<String> identifiers(Node node) {
        return node.findAll(SimpleName.class).stream()
                .map(SimpleName::getIdentifier)
                .collect(Collectors.toList());
    }

    private static <T extends Node> void collect(Node node, Class<T> type, List<T> found) {
        for (Node child : node.getChildNodes()) {
            if (child instanceof LambdaExpr || child instanceof BodyDeclaration) {
                continue;
            }
            if (type.isInstance(child)) {
                found.add(type.cast(child));
            }
            collect(child, type, found);
        }
    }
}
