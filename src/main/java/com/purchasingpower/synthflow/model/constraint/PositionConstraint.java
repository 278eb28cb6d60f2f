package com.purchasingpower.synthflow.model.constraint;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Governs the relative positions of two located elements, e.g. two characters in a string.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PositionConstraint implements Constraint {

    @Builder.Default
    List<String> elements = List.of();

    PositionRequirement requirement;

    @Builder.Default
    int minDistance = 0;

    Integer maxDistance;

    @Builder.Default
    Severity severity = Severity.ERROR;

    String description;

    @Override
    public ConstraintType getType() {
        return ConstraintType.POSITION;
    }

    @Override
    public String getDescription() {
        if (description != null) {
            return description;
        }
        String joined = String.join(" and ", elements.stream().map(e -> "'" + e + "'").toList());
        return switch (requirement) {
            case NOT_ADJACENT -> joined + " must not be adjacent (at least " + (minDistance + 1) + " apart)";
            case ORDERED -> joined + " must appear in order";
            case MIN_DISTANCE -> joined + " must be at least " + minDistance + " apart";
            case MAX_DISTANCE -> joined + " must be at most " + maxDistance + " apart";
        };
    }
}
