package com.purchasingpower.synthflow.planner;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Forbids one combination of hole values, e.g. {@code ¬(A=1) ∨ ¬(B=1)}.
 */
public class ClauseConstraint implements HoleConstraint {

    private final Map<String, String> forbidden;

    public ClauseConstraint(Map<String, String> forbidden) {
        Preconditions.checkArgument(!forbidden.isEmpty(), "forbidden combination must not be empty");
        this.forbidden = Collections.unmodifiableMap(new LinkedHashMap<>(forbidden));
    }

    public static ClauseConstraint forbid(String holeA, String valueA, String holeB, String valueB) {
        Map<String, String> pairs = new LinkedHashMap<>();
        pairs.put(holeA, valueA);
        pairs.put(holeB, valueB);
        return new ClauseConstraint(pairs);
    }

    @Override
    public String name() {
        return "forbid(" + describe() + ")";
    }

    @Override
    public Optional<ConflictReason> check(PartialAssignment assignment) {
        boolean allMatch = forbidden.entrySet().stream()
                .allMatch(e -> assignment.valueOf(e.getKey()).filter(e.getValue()::equals).isPresent());
        if (!allMatch) {
            return Optional.empty();
        }
        return Optional.of(new ConflictReason(new ArrayList<>(forbidden.keySet()),
                "forbidden combination " + describe()));
    }

    private String describe() {
        return forbidden.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
