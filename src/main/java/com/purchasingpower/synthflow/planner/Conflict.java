package com.purchasingpower.synthflow.planner;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A clause whose literals are all false under the current assignment.
 */
@Value
public class Conflict {

    List<Literal> literals;

    String reason;

    @Override
    public String toString() {
        return literals.isEmpty() ? "⊥" : literals.stream().map(Literal::toString).collect(Collectors.joining(" ∨ "));
    }
}
