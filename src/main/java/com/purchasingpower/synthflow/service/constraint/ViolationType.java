package com.purchasingpower.synthflow.service.constraint;

import com.purchasingpower.synthflow.model.constraint.ConstraintType;

public enum ViolationType {
    RETURN_CONSTRAINT,
    LOOP_CONSTRAINT,
    POSITION_CONSTRAINT,
    MISSING_FUNCTION,
    SYNTAX_ERROR;

    public static ViolationType of(ConstraintType type) {
        return switch (type) {
            case RETURN -> RETURN_CONSTRAINT;
            case LOOP_BEHAVIOR -> LOOP_CONSTRAINT;
            case POSITION -> POSITION_CONSTRAINT;
        };
    }
}
