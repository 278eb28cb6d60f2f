package com.purchasingpower.synthflow.service.constraint;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.model.constraint.Constraint;
import com.purchasingpower.synthflow.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.synthflow.model.constraint.LoopRequirement;
import com.purchasingpower.synthflow.model.constraint.PositionConstraint;
import com.purchasingpower.synthflow.model.constraint.PositionRequirement;
import com.purchasingpower.synthflow.model.constraint.ReturnConstraint;
import com.purchasingpower.synthflow.model.constraint.Severity;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.parser.JavaSourceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AST-based constraint validation using JavaParser.
 *
 * <p>Each constraint is checked independently against the target method, so adding a
 * constraint can only add violations.
 *
 * <p><b>Thread Safety:</b> Stateless and thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConstraintValidatorImpl implements ConstraintValidator {

    /** Value names that carry no information; any non-null return satisfies them. */
    private static final Set<String> GENERIC_VALUE_NAMES = Set.of("result", "value", "output", "answer");

    private static final Set<String> EARLY_EXIT_STREAM_OPS = Set.of(
            "findFirst", "findAny", "anyMatch", "noneMatch", "allMatch");

    private static final Set<String> ACCUMULATING_STREAM_OPS = Set.of(
            "collect", "toList", "reduce", "sum", "count", "forEach", "map", "filter");

    private static final Set<String> LOOKUP_METHODS = Set.of(
            "indexOf", "lastIndexOf", "charAt", "get", "find", "search", "codePointAt");

    private static final Set<BinaryExpr.Operator> ARITHMETIC = Set.of(
            BinaryExpr.Operator.PLUS, BinaryExpr.Operator.MINUS);

    private static final Set<BinaryExpr.Operator> RELATIONAL = Set.of(
            BinaryExpr.Operator.LESS, BinaryExpr.Operator.GREATER,
            BinaryExpr.Operator.LESS_EQUALS, BinaryExpr.Operator.GREATER_EQUALS);

    private static final Set<UnaryExpr.Operator> IN_PLACE_UPDATES = Set.of(
            UnaryExpr.Operator.PREFIX_INCREMENT, UnaryExpr.Operator.POSTFIX_INCREMENT,
            UnaryExpr.Operator.PREFIX_DECREMENT, UnaryExpr.Operator.POSTFIX_DECREMENT);

    private final ViolationFeedbackFormatter feedbackFormatter;

    @Override
    public List<ConstraintViolation> validate(String sourceCode, IntermediateRepresentation ir) {
        Preconditions.checkNotNull(sourceCode, "Source code cannot be null");
        Preconditions.checkNotNull(ir, "IR cannot be null");
        Preconditions.checkNotNull(ir.getSignature(), "IR signature cannot be null");

        CompilationUnit cu = JavaSourceParser.parse(sourceCode);
        String methodName = ir.getSignature().getName();

        Optional<MethodDeclaration> method = JavaSourceParser.findMethod(cu, methodName);
        if (method.isEmpty()) {
            log.debug("Method {} not found in generated code", methodName);
            return List.of(structural(ViolationType.MISSING_FUNCTION,
                    "Method '" + methodName + "' not found in generated code"));
        }

        Node body = method.get().getBody().map(Node.class::cast).orElse(method.get());

        List<ConstraintViolation> violations = new ArrayList<>();
        for (Constraint constraint : ir.getConstraints()) {
            Optional<String> failure = check(constraint, body);
            failure.ifPresent(message -> violations.add(ConstraintViolation.builder()
                    .constraint(constraint)
                    .type(ViolationType.of(constraint.getType()))
                    .message(message)
                    .severity(constraint.getSeverity())
                    .suggestion(feedbackFormatter.suggestion(ViolationType.of(constraint.getType()), constraint))
                    .build()));
        }

        if (!violations.isEmpty()) {
            log.debug("Validation of {} found {} violations", methodName, violations.size());
        }
        return violations;
    }

    private Optional<String> check(Constraint constraint, Node body) {
        if (constraint instanceof ReturnConstraint returnConstraint) {
            return checkReturn(returnConstraint, body);
        }
        if (constraint instanceof LoopBehaviorConstraint loop) {
            return checkLoop(loop, body);
        }
        if (constraint instanceof PositionConstraint position) {
            return checkPosition(position, body);
        }
        return Optional.empty();
    }

    /**
     * A return must exist, must not be null, and must derive from the expected value name.
     */
    private Optional<String> checkReturn(ReturnConstraint constraint, Node body) {
        String expected = constraint.getExpectedValueName();
        List<ReturnStmt> returns = JavaSourceParser.findOwn(body, ReturnStmt.class);

        if (returns.isEmpty()) {
            return Optional.of("No return statement found; the method must return the computed '"
                    + expected + "' value");
        }

        List<Expression> values = returns.stream()
                .map(ReturnStmt::getExpression)
                .flatMap(Optional::stream)
                .filter(e -> !e.isNullLiteralExpr())
                .collect(Collectors.toList());

        if (values.isEmpty()) {
            return Optional.of("Every return statement returns null or nothing; the method must return '"
                    + expected + "'");
        }

        if (expected == null || GENERIC_VALUE_NAMES.contains(expected.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }

        Set<String> derived = derivedVariables(body, expected);
        boolean matches = values.stream()
                .flatMap(value -> JavaSourceParser.identifiers(value).stream())
                .anyMatch(id -> mentions(id, expected) || derived.contains(id));

        return matches
                ? Optional.empty()
                : Optional.of("No returned expression is derived from '" + expected + "'");
    }

    /**
     * Local variables whose value flows from something named like {@code expected}, to a fixpoint.
     *
     * <p>Locals updated in place ({@code n++}, {@code total += x}) count as computed values whatever
     * their name, except for-loop update counters. This accepts a returned counter named differently
     * from the expected value, at the cost of also accepting an unrelated counter.
     */
    private Set<String> derivedVariables(Node body, String expected) {
        List<VariableDeclarator> declarators = JavaSourceParser.findOwn(body, VariableDeclarator.class);
        List<AssignExpr> assignments = JavaSourceParser.findOwn(body, AssignExpr.class);
        Set<String> derived = updatedInPlace(body, declarators, assignments);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (VariableDeclarator declarator : declarators) {
                String name = declarator.getNameAsString();
                if (!derived.contains(name) && declarator.getInitializer()
                        .map(init -> referencesAny(init, expected, derived))
                        .orElse(false)) {
                    changed |= derived.add(name);
                }
            }
            for (AssignExpr assignment : assignments) {
                if (!assignment.getTarget().isNameExpr()) {
                    continue;
                }
                String name = assignment.getTarget().asNameExpr().getNameAsString();
                if (!derived.contains(name) && referencesAny(assignment.getValue(), expected, derived)) {
                    changed |= derived.add(name);
                }
            }
        }
        return derived;
    }

    private static Set<String> updatedInPlace(Node body, List<VariableDeclarator> declarators, List<AssignExpr> assignments) {
        Set<String> locals = declarators.stream()
                .map(VariableDeclarator::getNameAsString)
                .collect(Collectors.toSet());
        Set<String> updated = new HashSet<>();
        for (UnaryExpr unary : JavaSourceParser.findOwn(body, UnaryExpr.class)) {
            if (IN_PLACE_UPDATES.contains(unary.getOperator())
                    && unary.getExpression().isNameExpr()
                    && !isForUpdate(unary)) {
                updated.add(unary.getExpression().asNameExpr().getNameAsString());
            }
        }
        for (AssignExpr assignment : assignments) {
            if (assignment.getOperator() != AssignExpr.Operator.ASSIGN
                    && assignment.getTarget().isNameExpr()
                    && !isForUpdate(assignment)) {
                updated.add(assignment.getTarget().asNameExpr().getNameAsString());
            }
        }
        updated.retainAll(locals);
        return updated;
    }

    private static boolean isForUpdate(Expression expression) {
        return expression.getParentNode()
                .filter(ForStmt.class::isInstance)
                .map(parent -> ((ForStmt) parent).getUpdate().stream().anyMatch(u -> u == expression))
                .orElse(false);
    }

    private boolean referencesAny(Expression expression, String expected, Set<String> derived) {
        return JavaSourceParser.identifiers(expression).stream()
                .anyMatch(id -> mentions(id, expected) || derived.contains(id));
    }

    private Optional<String> checkLoop(LoopBehaviorConstraint constraint, Node body) {
        List<Statement> loops = JavaSourceParser.findOwnLoops(body);
        Set<String> calls = JavaSourceParser.findOwn(body, MethodCallExpr.class).stream()
                .map(MethodCallExpr::getNameAsString)
                .collect(Collectors.toSet());

        if (constraint.getRequirement() == LoopRequirement.EARLY_RETURN) {
            if (loops.isEmpty()) {
                return calls.stream().anyMatch(EARLY_EXIT_STREAM_OPS::contains)
                        ? Optional.empty()
                        : Optional.of("No loop found; expected a loop that returns on the first match");
            }
            // Any depth counts: the return usually sits inside an if within the loop
            boolean returnsInside = loops.stream()
                    .anyMatch(loop -> !JavaSourceParser.findOwn(loop, ReturnStmt.class).isEmpty());
            return returnsInside
                    ? Optional.empty()
                    : Optional.of("Loop never returns early; a FIRST match search must return inside the loop "
                    + "as soon as the match is found");
        }

        if (loops.isEmpty()) {
            return calls.stream().anyMatch(ACCUMULATING_STREAM_OPS::contains)
                    ? Optional.empty()
                    : Optional.of("No loop found; expected a loop that visits every element");
        }
        boolean returnsInside = loops.stream()
                .anyMatch(loop -> !JavaSourceParser.findOwn(loop, ReturnStmt.class).isEmpty());
        return returnsInside
                ? Optional.of("Loop returns early; " + constraint.getSearchType().name().toLowerCase(Locale.ROOT)
                + " requires iterating every element and returning after the loop")
                : Optional.empty();
    }

    /**
     * Heuristic only: looks for a position lookup plus an expression relating positions.
     * Code that satisfies both can still be wrong.
     */
    private Optional<String> checkPosition(PositionConstraint constraint, Node body) {
        boolean hasLookup = JavaSourceParser.findOwn(body, MethodCallExpr.class).stream()
                .anyMatch(call -> LOOKUP_METHODS.contains(call.getNameAsString()))
                || !JavaSourceParser.findOwn(body, ArrayAccessExpr.class).isEmpty()
                || JavaSourceParser.identifiers(body).stream().anyMatch(ConstraintValidatorImpl::isPositionName);

        List<BinaryExpr.Operator> operators = JavaSourceParser.findOwn(body, BinaryExpr.class).stream()
                .map(BinaryExpr::getOperator)
                .collect(Collectors.toList());
        boolean hasRelational = operators.stream().anyMatch(RELATIONAL::contains);
        boolean hasArithmetic = operators.stream().anyMatch(ARITHMETIC::contains)
                || JavaSourceParser.findOwn(body, MethodCallExpr.class).stream()
                .anyMatch(call -> call.getNameAsString().equals("abs"));

        boolean relates = constraint.getRequirement() == PositionRequirement.ORDERED
                ? hasRelational
                : hasArithmetic || hasRelational;

        if (hasLookup && relates) {
            return Optional.empty();
        }

        String elements = constraint.getElements().stream()
                .map(e -> "'" + e + "'")
                .collect(Collectors.joining(" and "));
        return Optional.of("Heuristic check: no position lookup combined with a "
                + (constraint.getRequirement() == PositionRequirement.ORDERED ? "comparison" : "distance computation")
                + " relating " + elements + " (" + constraint.getDescription() + ")");
    }

    private ConstraintViolation structural(ViolationType type, String message) {
        return ConstraintViolation.builder()
                .type(type)
                .message(message)
                .severity(Severity.ERROR)
                .suggestion(feedbackFormatter.suggestion(type, null))
                .build();
    }

    private static boolean mentions(String identifier, String expected) {
        return identifier.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
    }

    private static boolean isPositionName(String identifier) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        return lower.contains("idx") || lower.contains("index") || lower.contains("pos");
    }
}
