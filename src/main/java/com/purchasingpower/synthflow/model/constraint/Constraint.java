package com.purchasingpower.synthflow.model.constraint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A structured, checkable requirement derived from an effect description.
 *
 * <p>Closed set of variants: {@link ReturnConstraint}, {@link LoopBehaviorConstraint} and
 * {@link PositionConstraint}. All variants are immutable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ReturnConstraint.class, name = "return_constraint"),
        @JsonSubTypes.Type(value = LoopBehaviorConstraint.class, name = "loop_constraint"),
        @JsonSubTypes.Type(value = PositionConstraint.class, name = "position_constraint")
})
public interface Constraint {

    @JsonIgnore
    ConstraintType getType();

    Severity getSeverity();

    String getDescription();
}
