package com.purchasingpower.synthflow.model.constraint;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Governs whether a loop exits on its first match or runs to completion.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LoopBehaviorConstraint implements Constraint {

    LoopSearchType searchType;

    LoopRequirement requirement;

    /**
     * Iterated collection named in the effect text, null if none was named.
     */
    String loopVariable;

    @Builder.Default
    Severity severity = Severity.ERROR;

    String description;

    public static LoopBehaviorConstraint of(LoopSearchType searchType, LoopRequirement requirement) {
        return LoopBehaviorConstraint.builder().searchType(searchType).requirement(requirement).build();
    }

    @Override
    public ConstraintType getType() {
        return ConstraintType.LOOP_BEHAVIOR;
    }

    @Override
    public String getDescription() {
        if (description != null) {
            return description;
        }
        return switch (requirement) {
            case EARLY_RETURN -> "Loop must return immediately on the first match";
            case ACCUMULATE -> "Loop must iterate all elements and accumulate matches ("
                    + searchType.name().toLowerCase() + ")";
            case TRANSFORM -> "Loop must transform every element before returning";
        };
    }
}
