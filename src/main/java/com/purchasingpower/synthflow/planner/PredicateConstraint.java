package com.purchasingpower.synthflow.planner;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Arbitrary predicate over a fixed set of holes, evaluated once all of them are assigned.
 */
public class PredicateConstraint implements HoleConstraint {

    private final String name;
    private final List<String> scope;
    private final Predicate<Map<String, String>> predicate;

    public PredicateConstraint(String name, List<String> scope, Predicate<Map<String, String>> predicate) {
        Preconditions.checkArgument(!scope.isEmpty(), "scope must not be empty");
        this.name = name;
        this.scope = List.copyOf(scope);
        this.predicate = predicate;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<ConflictReason> check(PartialAssignment assignment) {
        if (!assignment.assignsAll(scope)) {
            return Optional.empty();
        }
        Map<String, String> values = assignment.restrictTo(scope);
        if (predicate.test(values)) {
            return Optional.empty();
        }
        return Optional.of(new ConflictReason(scope, name + " rejects " + values));
    }
}
