package com.purchasingpower.synthflow.planner;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Disjunction of literals. Domain clauses encode "each hole takes exactly one value";
 * learned clauses are derived from conflicts.
 */
@Value
public class Clause {

    int id;

    List<Literal> literals;

    boolean learned;

    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return "⊥";
        }
        return literals.stream().map(Literal::toString).collect(Collectors.joining(" ∨ "));
    }
}
