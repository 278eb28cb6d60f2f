package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.service.semantic.SemanticInterpreter;
import com.purchasingpower.synthflow.service.semantic.SemanticIssue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rejects assignments whose resolved IR has blocking semantic issues.
 */
public class SemanticConstraint implements HoleConstraint {

    private final SemanticInterpreter interpreter;
    private final List<String> scope;

    public SemanticConstraint(SemanticInterpreter interpreter, List<String> scope) {
        this.interpreter = interpreter;
        this.scope = List.copyOf(scope);
    }

    /**
     * Checks the fully resolved IR, blaming every planned hole.
     */
    public SemanticConstraint(SemanticInterpreter interpreter) {
        this(interpreter, List.of());
    }

    @Override
    public String name() {
        return scope.isEmpty() ? "semantics" : "semantics" + scope;
    }

    @Override
    public Optional<ConflictReason> check(PartialAssignment assignment) {
        List<String> holes = scope.isEmpty() ? assignment.plannedHoles() : scope;
        if (!assignment.assignsAll(holes)) {
            return Optional.empty();
        }
        List<SemanticIssue> errors = interpreter.interpret(assignment.resolve()).stream()
                .filter(SemanticIssue::isBlocking)
                .collect(Collectors.toList());
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        String explanation = errors.stream().map(SemanticIssue::getMessage).collect(Collectors.joining("; "));
        return Optional.of(new ConflictReason(holes, explanation));
    }
}
