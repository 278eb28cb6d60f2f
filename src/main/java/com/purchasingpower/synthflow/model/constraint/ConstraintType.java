package com.purchasingpower.synthflow.model.constraint;

public enum ConstraintType {
    RETURN("return_constraint"),
    LOOP_BEHAVIOR("loop_constraint"),
    POSITION("position_constraint");

    private final String wireName;

    ConstraintType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
